package com.attendpush.domain.exception;

/**
 * Excepción lanzada cuando ocurre un error de E/S sobre el log intermedio.
 */
public class PunchLogException extends RuntimeException {

    public PunchLogException(String message) {
        super(message);
    }

    public PunchLogException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Excepción cuando no se puede escribir al log.
     */
    public static PunchLogException cannotWrite(String filePath, Throwable cause) {
        return new PunchLogException("No se puede escribir al log intermedio: " + filePath, cause);
    }

    /**
     * Excepción cuando no se puede leer el log.
     */
    public static PunchLogException cannotRead(String filePath, Throwable cause) {
        return new PunchLogException("No se puede leer el log intermedio: " + filePath, cause);
    }

    public static PunchLogException notReady(String filePath) {
        return new PunchLogException("Log intermedio no inicializado: " + filePath);
    }
}
