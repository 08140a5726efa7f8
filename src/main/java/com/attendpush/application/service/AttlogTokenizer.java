package com.attendpush.application.service;

import com.attendpush.domain.model.AttendancePunch;
import com.attendpush.domain.model.ParseResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Tokenizador estricto de líneas ATTLOG.
 * Formato mínimo: externalId, fecha, hora, dirección, tipo de evento
 * separados por tabulador o espacios. Los tokens sobrantes quedan como
 * campos auxiliares.
 */
@Component
public class AttlogTokenizer {

    static final int MIN_TOKENS = 5;

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern REQUEST_LINE = Pattern.compile("^(GET|POST|PUT|HEAD)\\s+\\S+\\s+HTTP/.*");
    private static final Pattern HEADER_LINE = Pattern.compile("^[A-Za-z][A-Za-z0-9-]*:\\s.*");

    /** Posición del serial contada desde el final de la línea (0 = no se usa) */
    private final int serialOffset;

    /** Posición del id de registro del terminal contada desde el final (0 = no se usa) */
    private final int recordIdOffset;

    public AttlogTokenizer(
            @Value("${punch.trailing.serial-offset:0}") int serialOffset,
            @Value("${punch.trailing.record-id-offset:0}") int recordIdOffset) {
        this.serialOffset = serialOffset;
        this.recordIdOffset = recordIdOffset;
    }

    /**
     * Tokeniza un payload completo. Las líneas vacías y los fragmentos de
     * protocolo no producen resultado.
     */
    public List<ParseResult> tokenize(String payload, String declaredSerial, String deviceLabel,
            LocalDateTime receivedAt) {
        List<ParseResult> results = new ArrayList<>();
        if (payload == null) {
            return results;
        }

        for (String raw : payload.split("\\r?\\n")) {
            String line = raw.trim();
            if (line.isEmpty() || isProtocolFragment(line)) {
                continue;
            }
            results.add(parseLine(line, declaredSerial, deviceLabel, receivedAt));
        }
        return results;
    }

    public ParseResult parseLine(String line, String declaredSerial, String deviceLabel, LocalDateTime receivedAt) {
        String[] tokens = WHITESPACE.split(line.trim());
        if (tokens.length < MIN_TOKENS) {
            return ParseResult.error("se esperaban al menos " + MIN_TOKENS + " tokens, hay " + tokens.length, line);
        }

        if (tokens[0].length() > AttendancePunch.MAX_EXTERNAL_ID_LENGTH) {
            return ParseResult.error("id de usuario de " + tokens[0].length() + " caracteres, máximo "
                    + AttendancePunch.MAX_EXTERNAL_ID_LENGTH, line);
        }

        LocalDateTime timestamp;
        try {
            timestamp = LocalDateTime.parse(tokens[1] + " " + tokens[2], TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            return ParseResult.error("timestamp inválido: " + tokens[1] + " " + tokens[2], line);
        }

        int direction;
        int eventType;
        try {
            direction = Integer.parseInt(tokens[3]);
            eventType = Integer.parseInt(tokens[4]);
        } catch (NumberFormatException e) {
            return ParseResult.error("dirección o tipo de evento no numérico", line);
        }

        List<String> auxiliary = new ArrayList<>(Arrays.asList(tokens).subList(MIN_TOKENS, tokens.length));

        AttendancePunch punch = AttendancePunch.builder()
                .externalId(tokens[0])
                .timestamp(timestamp)
                .direction(direction)
                .eventType(eventType)
                .deviceSerial(resolveSerial(declaredSerial, auxiliary))
                .deviceLabel(deviceLabel)
                .deviceRecordId(trailing(auxiliary, recordIdOffset, ""))
                .auxiliaryFields(auxiliary)
                .receivedAt(receivedAt)
                .build();
        return ParseResult.ok(punch, line);
    }

    /**
     * El serial declarado en la petición tiene prioridad sobre el que viaja en
     * la línea.
     */
    private String resolveSerial(String declaredSerial, List<String> auxiliary) {
        if (declaredSerial != null && !declaredSerial.isBlank()) {
            return declaredSerial.trim();
        }
        return trailing(auxiliary, serialOffset, AttendancePunch.UNKNOWN_SERIAL);
    }

    private static String trailing(List<String> auxiliary, int offset, String fallback) {
        if (offset <= 0 || offset > auxiliary.size()) {
            return fallback;
        }
        String value = auxiliary.get(auxiliary.size() - offset);
        return value.isBlank() ? fallback : value;
    }

    private static boolean isProtocolFragment(String line) {
        return REQUEST_LINE.matcher(line).matches() || HEADER_LINE.matcher(line).matches();
    }
}
