package com.attendpush.domain.exception;

/**
 * Excepción lanzada cuando no se puede persistir el documento de estado.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public static StateStoreException cannotWrite(String filePath, Throwable cause) {
        return new StateStoreException("No se puede escribir el estado: " + filePath, cause);
    }
}
