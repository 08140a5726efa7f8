package com.attendpush.infrastructure.file;

import com.attendpush.domain.model.AttendancePunch;
import com.attendpush.domain.model.LogEntry;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;

import java.io.IOException;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Formato CSV del log intermedio: una marcación por línea, con número de
 * secuencia creciente.
 * Formato: seq,external_id,timestamp,direction,event_type,device_serial,
 * device_label,device_record_id,received_at,auxiliary
 */
final class PunchLogFormat {

    static final String[] HEADER = {
            "seq", "external_id", "timestamp", "direction", "event_type",
            "device_serial", "device_label", "device_record_id", "received_at", "auxiliary"
    };

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);
    static final DateTimeFormatter RECEIVED_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss.SSS")
            .withResolverStyle(ResolverStyle.STRICT);

    private PunchLogFormat() {
    }

    /**
     * Fila leída del log junto con su interpretación.
     */
    static final class Row {
        final String[] fields;
        final LogEntry entry;

        Row(String[] fields, LogEntry entry) {
            this.fields = fields;
            this.entry = entry;
        }
    }

    static CSVWriter newWriter(Writer target) {
        return new CSVWriter(target, CSVWriter.DEFAULT_SEPARATOR, CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER, "\n");
    }

    static String[] toRow(AttendancePunch punch) {
        return new String[] {
                String.valueOf(punch.getSequence()),
                punch.getExternalId(),
                punch.getTimestamp().format(TIMESTAMP_FORMAT),
                String.valueOf(punch.getDirection()),
                String.valueOf(punch.getEventType()),
                nullToEmpty(punch.getDeviceSerial()),
                nullToEmpty(punch.getDeviceLabel()),
                nullToEmpty(punch.getDeviceRecordId()),
                punch.getReceivedAt() != null ? punch.getReceivedAt().format(RECEIVED_FORMAT) : "",
                String.join(" ", punch.getAuxiliaryFields())
        };
    }

    /**
     * Lee las filas completas del log. Una línea final sin salto de línea es
     * una escritura interrumpida y se ignora.
     */
    static List<Row> readRows(Path path) throws IOException, CsvException {
        List<Row> rows = new ArrayList<>();
        if (!Files.exists(path)) {
            return rows;
        }

        byte[] bytes = Files.readAllBytes(path);
        int end = lastNewline(bytes) + 1;
        if (end == 0) {
            return rows;
        }

        try (CSVReader reader = new CSVReaderBuilder(new StringReader(new String(bytes, 0, end, StandardCharsets.UTF_8)))
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build()) {
            for (String[] fields : reader.readAll()) {
                if (fields.length == 0 || HEADER[0].equals(fields[0]) || isBlank(fields)) {
                    continue;
                }
                LogEntry entry = parseRow(fields);
                if (entry != null) {
                    rows.add(new Row(fields, entry));
                }
            }
        }
        return rows;
    }

    static List<LogEntry> readEntries(Path path) throws IOException, CsvException {
        List<LogEntry> entries = new ArrayList<>();
        for (Row row : readRows(path)) {
            entries.add(row.entry);
        }
        return entries;
    }

    static int lastNewline(byte[] bytes) {
        for (int i = bytes.length - 1; i >= 0; i--) {
            if (bytes[i] == '\n') {
                return i;
            }
        }
        return -1;
    }

    /**
     * Convierte una fila a entrada. Sin secuencia legible la fila no puede
     * ubicarse y se devuelve null.
     */
    private static LogEntry parseRow(String[] f) {
        long sequence;
        try {
            sequence = Long.parseLong(f[0].trim());
        } catch (NumberFormatException e) {
            return null;
        }

        if (f.length < HEADER.length) {
            return LogEntry.invalid(sequence, "fila incompleta: " + f.length + " campos");
        }

        String externalId = f[1].trim();
        if (externalId.isEmpty() || externalId.length() > AttendancePunch.MAX_EXTERNAL_ID_LENGTH) {
            return LogEntry.invalid(sequence, "id de usuario inválido (" + externalId.length() + " caracteres)");
        }

        try {
            AttendancePunch punch = AttendancePunch.builder()
                    .sequence(sequence)
                    .externalId(externalId)
                    .timestamp(LocalDateTime.parse(f[2].trim(), TIMESTAMP_FORMAT))
                    .direction(Integer.parseInt(f[3].trim()))
                    .eventType(Integer.parseInt(f[4].trim()))
                    .deviceSerial(f[5])
                    .deviceLabel(f[6])
                    .deviceRecordId(f[7])
                    .receivedAt(f[8].isBlank() ? null : LocalDateTime.parse(f[8].trim(), RECEIVED_FORMAT))
                    .auxiliaryFields(f[9].isBlank()
                            ? new ArrayList<>()
                            : new ArrayList<>(Arrays.asList(f[9].trim().split(" "))))
                    .build();
            return LogEntry.valid(sequence, punch);
        } catch (DateTimeParseException e) {
            return LogEntry.invalid(sequence, "timestamp inválido: " + f[2]);
        } catch (NumberFormatException e) {
            return LogEntry.invalid(sequence, "campo numérico inválido: " + e.getMessage());
        }
    }

    private static boolean isBlank(String[] fields) {
        return fields.length == 1 && fields[0].isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
