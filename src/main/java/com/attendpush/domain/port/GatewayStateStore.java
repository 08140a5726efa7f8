package com.attendpush.domain.port;

import java.util.Map;

/**
 * Documento clave-valor durable con el estado del gateway (cursor de
 * procesamiento, contador de comandos). Cada escritura reemplaza el documento
 * de forma atómica.
 */
public interface GatewayStateStore {

    String PROCESSING_CURSOR = "processing.cursor";
    String NEXT_COMMAND_ID = "command.next-id";
    String LAST_ACKED_COMMAND_ID = "command.last-acked-id";

    long get(String key, long defaultValue);

    void put(String key, long value);

    Map<String, Long> snapshot();
}
