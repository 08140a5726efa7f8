package com.attendpush.infrastructure.file;

import com.attendpush.domain.exception.PunchLogException;
import com.attendpush.domain.model.LogEntry;
import com.attendpush.domain.port.PunchLogReader;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Implementación del puerto PunchLogReader para leer el log intermedio.
 * Usado por el loader del store en cada pasada.
 */
@Component
@Slf4j
public class CsvPunchLogReader implements PunchLogReader {

    @Value("${punchlog.path:./data_logs/punches.csv}")
    private String logPath;

    @Override
    public List<LogEntry> readAfter(long afterSequence) {
        Path path = Paths.get(logPath);
        try {
            List<LogEntry> pending = PunchLogFormat.readEntries(path).stream()
                    .filter(entry -> entry.getSequence() > afterSequence)
                    .sorted(Comparator.comparingLong(LogEntry::getSequence))
                    .collect(Collectors.toList());

            log.debug("Leídas {} entradas pendientes del log {} (cursor {})", pending.size(), path, afterSequence);
            return pending;

        } catch (IOException | CsvException e) {
            throw PunchLogException.cannotRead(logPath, e);
        }
    }
}
