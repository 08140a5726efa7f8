package com.attendpush.domain.model;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * Comando entregado a un terminal y pendiente de confirmación.
 */
@Value
public class IssuedCommand {

    long id;
    int port;
    String text;
    LocalDateTime issuedAt;

    /**
     * Formato de la línea que recibe el terminal: {@code C:<id>:<comando>}.
     */
    public String toWireFormat() {
        return "C:" + id + ":" + text;
    }
}
