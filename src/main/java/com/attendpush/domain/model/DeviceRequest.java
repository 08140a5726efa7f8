package com.attendpush.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * Petición HTTP de un terminal ya separada en línea de petición, query,
 * cabeceras y cuerpo.
 */
@Value
@Builder
public class DeviceRequest {

    String method;
    String path;

    @Builder.Default
    Map<String, String> query = Collections.emptyMap();

    @Builder.Default
    Map<String, String> headers = Collections.emptyMap();

    @Builder.Default
    String body = "";

    /** Serial declarado por el terminal (SN=...), o null */
    String serial;

    public String param(String name) {
        return query.get(name);
    }

    /**
     * Busca un parámetro sin distinguir mayúsculas en el nombre.
     */
    public String paramIgnoreCase(String name) {
        for (Map.Entry<String, String> e : query.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) {
                return e.getValue();
            }
        }
        return null;
    }

    public boolean isGet() {
        return "GET".equalsIgnoreCase(method);
    }

    public boolean isPost() {
        return "POST".equalsIgnoreCase(method);
    }
}
