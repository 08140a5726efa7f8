package com.attendpush.infrastructure.device;

import com.attendpush.domain.model.DeviceRequest;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser de las peticiones HTTP que envían los terminales.
 * Trabaja sobre bytes para que Content-Length se compare contra bytes, no
 * contra caracteres.
 */
public final class DeviceRequestParser {

    private static final Pattern SERIAL_PATTERN = Pattern.compile("SN=([^&\\s]+)");
    private static final Pattern CONTENT_LENGTH = Pattern.compile("(?im)^content-length:\\s*(\\d+)\\s*$");

    private DeviceRequestParser() {
    }

    /**
     * Posición donde empieza el cuerpo (después de la línea vacía que cierra
     * las cabeceras), o -1 si las cabeceras aún no están completas.
     */
    static int bodyStart(byte[] data, int length) {
        for (int i = 0; i < length - 1; i++) {
            if (data[i] == '\n') {
                if (data[i + 1] == '\n') {
                    return i + 2;
                }
                if (data[i + 1] == '\r' && i + 2 < length && data[i + 2] == '\n') {
                    return i + 3;
                }
            }
        }
        return -1;
    }

    static int contentLength(String headerBlock) {
        Matcher m = CONTENT_LENGTH.matcher(headerBlock);
        if (m.find()) {
            try {
                return Integer.parseInt(m.group(1));
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    /**
     * Tamaño total esperado de la petición (cabeceras + cuerpo declarado), o
     * -1 si las cabeceras aún no llegaron completas.
     */
    public static int expectedLength(byte[] data, int length) {
        int start = bodyStart(data, length);
        if (start < 0) {
            return -1;
        }
        String headers = new String(data, 0, start, StandardCharsets.UTF_8);
        return start + contentLength(headers);
    }

    /**
     * Separa la petición en línea de petición, query, cabeceras y cuerpo.
     *
     * @throws IllegalArgumentException si no hay una línea de petición válida
     */
    public static DeviceRequest parse(byte[] data, int length) {
        int start = bodyStart(data, length);
        int headerEnd = start < 0 ? length : start;
        String headerBlock = new String(data, 0, headerEnd, StandardCharsets.UTF_8);
        String[] lines = headerBlock.split("\\r?\\n");

        String[] requestLine = lines[0].trim().split("\\s+");
        if (requestLine.length < 2 || requestLine[0].isEmpty()) {
            throw new IllegalArgumentException("Línea de petición inválida: " + lines[0]);
        }

        String target = requestLine[1];
        int q = target.indexOf('?');
        String path = q >= 0 ? target.substring(0, q) : target;
        Map<String, String> query = q >= 0 ? parseQuery(target.substring(q + 1)) : new LinkedHashMap<>();

        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (int i = 1; i < lines.length; i++) {
            int colon = lines[i].indexOf(':');
            if (colon > 0) {
                headers.put(lines[i].substring(0, colon).trim(), lines[i].substring(colon + 1).trim());
            }
        }

        String body = "";
        if (start >= 0 && start < length) {
            int declared = contentLength(headerBlock);
            int end = declared > 0 ? Math.min(length, start + declared) : length;
            body = new String(data, start, end - start, StandardCharsets.UTF_8);
        }

        return DeviceRequest.builder()
                .method(requestLine[0].toUpperCase())
                .path(path)
                .query(query)
                .headers(headers)
                .body(body)
                .serial(resolveSerial(query, headerBlock))
                .build();
    }

    private static Map<String, String> parseQuery(String raw) {
        Map<String, String> params = new LinkedHashMap<>();
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            params.put(decode(name), decode(value));
        }
        return params;
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }

    private static String resolveSerial(Map<String, String> query, String headerBlock) {
        for (Map.Entry<String, String> e : query.entrySet()) {
            if (e.getKey().equalsIgnoreCase("SN") && !e.getValue().isBlank()) {
                return e.getValue();
            }
        }
        Matcher m = SERIAL_PATTERN.matcher(headerBlock);
        return m.find() ? m.group(1) : null;
    }
}
