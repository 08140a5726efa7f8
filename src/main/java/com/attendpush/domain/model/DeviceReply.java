package com.attendpush.domain.model;

import lombok.Value;

/**
 * Respuesta mínima a un terminal: siempre 200 con cuerpo de texto plano.
 */
@Value
public class DeviceReply {

    public static final String ACK = "OK";

    String body;

    public static DeviceReply ack() {
        return new DeviceReply(ACK);
    }

    public static DeviceReply of(String body) {
        return new DeviceReply(body == null ? "" : body);
    }
}
