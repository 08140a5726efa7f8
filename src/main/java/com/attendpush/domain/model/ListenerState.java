package com.attendpush.domain.model;

/**
 * Estados del listener de un puerto de terminales.
 */
public enum ListenerState {

    /** Creado, aún sin intentar el bind */
    STARTING,

    /** Aceptando conexiones */
    LISTENING,

    /** El bind falló y se reintenta con backoff */
    RETRYING,

    /** Se agotaron los reintentos de bind; el puerto queda fuera de servicio */
    FAILED,

    STOPPED
}
