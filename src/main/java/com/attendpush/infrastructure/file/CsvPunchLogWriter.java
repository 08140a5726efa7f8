package com.attendpush.infrastructure.file;

import com.attendpush.domain.exception.PunchLogException;
import com.attendpush.domain.model.AttendancePunch;
import com.attendpush.domain.model.LogEntry;
import com.attendpush.domain.model.PunchKey;
import com.attendpush.domain.port.GatewayStateStore;
import com.attendpush.domain.port.PunchLogWriter;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Implementación del puerto PunchLogWriter sobre un archivo CSV de solo
 * agregado.
 *
 * - Cada lote se escribe con una sola operación de append seguida de force,
 * bajo un único lock, para que dos conexiones no intercalen líneas.
 * - Una línea final incompleta (caída a mitad de escritura) se trunca al
 * arrancar; los lectores nunca la ven.
 * - El conjunto de claves vistas se reconstruye desde el log al arrancar.
 * - La compactación por antigüedad reescribe con archivo temporal + rename
 * atómico.
 */
@Component
@Slf4j
public class CsvPunchLogWriter implements PunchLogWriter {

    @Value("${punchlog.path:./data_logs/punches.csv}")
    private String logPath;

    private final GatewayStateStore stateStore;

    private final Object writeLock = new Object();
    private final Set<PunchKey> seenKeys = new HashSet<>();
    private long lastSequence = 0;
    private boolean initialized = false;

    public CsvPunchLogWriter(GatewayStateStore stateStore) {
        this.stateStore = stateStore;
    }

    @PostConstruct
    public void init() {
        synchronized (writeLock) {
            try {
                Path path = Paths.get(logPath);
                if (path.getParent() != null && !Files.exists(path.getParent())) {
                    Files.createDirectories(path.getParent());
                    log.info("Directorio creado: {}", path.getParent().toAbsolutePath());
                }

                if (!Files.exists(path)) {
                    appendBytes(path, headerLine());
                    log.info("Nuevo log intermedio creado: {}", path.toAbsolutePath());
                } else {
                    repairTornTail(path);
                }

                List<LogEntry> entries = PunchLogFormat.readEntries(path);
                rebuildSeenKeys(entries);
                long maxSequence = entries.stream().mapToLong(LogEntry::getSequence).max().orElse(0);
                // La compactación puede haber eliminado las entradas más altas ya absorbidas
                lastSequence = Math.max(maxSequence, stateStore.get(GatewayStateStore.PROCESSING_CURSOR, 0));

                initialized = true;
                log.info("Log intermedio listo: {} ({} entradas, {} claves vistas, última secuencia {})",
                        path, entries.size(), seenKeys.size(), lastSequence);

            } catch (IOException | CsvException | RuntimeException e) {
                initialized = false;
                log.error("Error inicializando el log intermedio {}: {}", logPath, e.getMessage(), e);
            }
        }
    }

    @Override
    public List<AttendancePunch> appendUnseen(List<AttendancePunch> punches) {
        synchronized (writeLock) {
            if (!initialized) {
                throw PunchLogException.notReady(logPath);
            }

            List<AttendancePunch> fresh = new ArrayList<>();
            Set<PunchKey> batchKeys = new HashSet<>();
            for (AttendancePunch punch : punches) {
                PunchKey key = punch.key();
                if (seenKeys.contains(key) || !batchKeys.add(key)) {
                    log.debug("Marcación duplicada descartada: {}", key);
                    continue;
                }
                fresh.add(punch);
            }

            if (fresh.isEmpty()) {
                return fresh;
            }

            Path path = Paths.get(logPath);
            long sequence = lastSequence;
            StringWriter buffer = new StringWriter();
            try (CSVWriter writer = PunchLogFormat.newWriter(buffer)) {
                if (!Files.exists(path)) {
                    log.warn("⚠ El log intermedio fue borrado durante ejecución, se recrea: {}", path);
                    writer.writeNext(PunchLogFormat.HEADER, false);
                }
                for (AttendancePunch punch : fresh) {
                    punch.setSequence(++sequence);
                    writer.writeNext(PunchLogFormat.toRow(punch));
                }
                writer.flush();
                appendBytes(path, buffer.toString().getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                fresh.forEach(p -> p.setSequence(null));
                throw PunchLogException.cannotWrite(logPath, e);
            }

            lastSequence = sequence;
            fresh.forEach(p -> seenKeys.add(p.key()));
            log.info("Agregadas {} marcaciones al log intermedio (secuencia hasta {})", fresh.size(), lastSequence);
            return fresh;
        }
    }

    @Override
    public boolean isSeen(PunchKey key) {
        synchronized (writeLock) {
            return seenKeys.contains(key);
        }
    }

    @Override
    public int compact(LocalDateTime cutoff, long absorbedUpTo) {
        synchronized (writeLock) {
            if (!initialized) {
                throw PunchLogException.notReady(logPath);
            }

            Path path = Paths.get(logPath);
            try {
                List<PunchLogFormat.Row> rows = PunchLogFormat.readRows(path);
                List<PunchLogFormat.Row> kept = new ArrayList<>();
                for (PunchLogFormat.Row row : rows) {
                    if (!isExpired(row.entry, cutoff, absorbedUpTo)) {
                        kept.add(row);
                    }
                }

                int removed = rows.size() - kept.size();
                if (removed == 0) {
                    return 0;
                }

                StringWriter buffer = new StringWriter();
                try (CSVWriter writer = PunchLogFormat.newWriter(buffer)) {
                    writer.writeNext(PunchLogFormat.HEADER, false);
                    for (PunchLogFormat.Row row : kept) {
                        writer.writeNext(row.fields);
                    }
                }

                Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
                Files.write(tmp, buffer.toString().getBytes(StandardCharsets.UTF_8));
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

                List<LogEntry> keptEntries = new ArrayList<>();
                kept.forEach(r -> keptEntries.add(r.entry));
                rebuildSeenKeys(keptEntries);

                log.info("Log intermedio compactado: {} entradas eliminadas, {} conservadas", removed, kept.size());
                return removed;

            } catch (IOException | CsvException e) {
                throw PunchLogException.cannotWrite(logPath, e);
            }
        }
    }

    @Override
    public long lastSequence() {
        synchronized (writeLock) {
            return lastSequence;
        }
    }

    @Override
    public boolean isReady() {
        return initialized;
    }

    private boolean isExpired(LogEntry entry, LocalDateTime cutoff, long absorbedUpTo) {
        if (entry.getSequence() > absorbedUpTo) {
            return false;
        }
        if (!entry.isValid() || entry.getPunch().getReceivedAt() == null) {
            return true;
        }
        return entry.getPunch().getReceivedAt().isBefore(cutoff);
    }

    private void rebuildSeenKeys(List<LogEntry> entries) {
        seenKeys.clear();
        for (LogEntry entry : entries) {
            if (entry.isValid()) {
                seenKeys.add(entry.getPunch().key());
            }
        }
    }

    /**
     * Descarta la última línea si no termina en salto de línea.
     */
    private void repairTornTail(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        if (bytes.length == 0 || bytes[bytes.length - 1] == '\n') {
            return;
        }

        int keep = PunchLogFormat.lastNewline(bytes) + 1;
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
            channel.truncate(keep);
            channel.force(true);
        }
        log.warn("⚠ Línea incompleta al final del log intermedio descartada ({} bytes)", bytes.length - keep);
    }

    private static byte[] headerLine() {
        return (String.join(",", PunchLogFormat.HEADER) + "\n").getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Agrega bytes al final del archivo y fuerza su escritura a disco. Si la
     * escritura falla a medias se trunca al tamaño anterior.
     */
    private void appendBytes(Path path, byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(path,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            long before = channel.size();
            try {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            } catch (IOException e) {
                try {
                    channel.truncate(before);
                } catch (IOException truncateError) {
                    e.addSuppressed(truncateError);
                }
                throw e;
            }
        }
    }
}
