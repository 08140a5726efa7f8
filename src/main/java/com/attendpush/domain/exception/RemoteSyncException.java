package com.attendpush.domain.exception;

/**
 * Excepción lanzada cuando falla el reenvío de una marcación a la API remota.
 */
public class RemoteSyncException extends RuntimeException {

    public RemoteSyncException(String message) {
        super(message);
    }

    public RemoteSyncException(String message, Throwable cause) {
        super(message, cause);
    }

    public static RemoteSyncException requestFailed(Long punchId, Throwable cause) {
        return new RemoteSyncException("Fallo la llamada remota para la marcación " + punchId, cause);
    }

    public static RemoteSyncException unexpectedStatus(Long punchId, int status) {
        return new RemoteSyncException(
                String.format("Estado HTTP %d inesperado para la marcación %d", status, punchId));
    }

    /**
     * Excepción cuando el cuerpo del acuse no trae los identificadores esperados.
     */
    public static RemoteSyncException malformedAck(Long punchId, String detail) {
        return new RemoteSyncException(
                String.format("Acuse remoto inválido para la marcación %d: %s", punchId, detail));
    }
}
