package com.attendpush.domain.exception;

/**
 * Excepción lanzada cuando un listener no logra abrir su puerto.
 */
public class GatewayBindException extends RuntimeException {

    public GatewayBindException(String message) {
        super(message);
    }

    public GatewayBindException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Excepción cuando se agotan los reintentos de bind.
     */
    public static GatewayBindException exhausted(String host, int port, int attempts, Throwable cause) {
        return new GatewayBindException(
                String.format("No se pudo abrir %s:%d tras %d intentos", host, port, attempts), cause);
    }
}
