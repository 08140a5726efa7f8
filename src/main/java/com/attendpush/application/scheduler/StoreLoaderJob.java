package com.attendpush.application.scheduler;

import com.attendpush.domain.exception.PunchLogException;
import com.attendpush.domain.exception.StateStoreException;
import com.attendpush.domain.model.LogEntry;
import com.attendpush.domain.port.GatewayStateStore;
import com.attendpush.domain.port.PunchLogReader;
import com.attendpush.domain.port.PunchRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Job periódico que absorbe el log intermedio en el store.
 *
 * El cursor de procesamiento se persiste solo después de que todas las
 * inserciones de la pasada quedaron confirmadas. Si el proceso cae entre la
 * última inserción y el cursor, la pasada siguiente repite esas inserciones
 * y la restricción única las descarta.
 */
@Component
@Slf4j
public class StoreLoaderJob {

    private final PunchLogReader logReader;
    private final PunchRepository punchRepository;
    private final GatewayStateStore stateStore;
    private final TaskScheduler taskScheduler;

    @Value("${loader.interval-ms:10000}")
    private long intervalMs;

    @Value("${loader.enabled:true}")
    private boolean enabled;

    private ScheduledFuture<?> scheduledTask;

    // --- Tracking de la última ejecución ---
    @Getter
    private LocalDateTime lastRunTime;
    @Getter
    private int lastRunInserted;
    @Getter
    private int lastRunDuplicates;
    @Getter
    private int lastRunSkipped;
    @Getter
    private boolean lastRunSuccess;
    @Getter
    private String lastRunError;

    public StoreLoaderJob(PunchLogReader logReader,
            PunchRepository punchRepository,
            GatewayStateStore stateStore,
            TaskScheduler taskScheduler) {
        this.logReader = logReader;
        this.punchRepository = punchRepository;
        this.stateStore = stateStore;
        this.taskScheduler = taskScheduler;
    }

    @PostConstruct
    public void init() {
        if (!enabled) {
            log.info("Loader del store deshabilitado (loader.enabled=false)");
            return;
        }
        scheduledTask = taskScheduler.scheduleWithFixedDelay(this::scheduledPass, Duration.ofMillis(intervalMs));
        log.info("Loader del store programado cada {} ms", intervalMs);
    }

    @PreDestroy
    public void shutdown() {
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
        }
    }

    /**
     * Ejecución programada: ningún error debe cancelar las pasadas siguientes.
     */
    void scheduledPass() {
        try {
            runPass();
        } catch (RuntimeException e) {
            log.error("Error inesperado en el loader del store: {}", e.getMessage(), e);
            updateLastRun(0, 0, 0, false, e.getMessage());
        }
    }

    /**
     * Una pasada del loader.
     *
     * @return Número de filas insertadas
     */
    public synchronized int runPass() {
        long cursor = stateStore.get(GatewayStateStore.PROCESSING_CURSOR, 0);

        List<LogEntry> entries;
        try {
            entries = logReader.readAfter(cursor);
        } catch (PunchLogException e) {
            log.error("✗ No se pudo leer el log intermedio: {}", e.getMessage());
            updateLastRun(0, 0, 0, false, e.getMessage());
            return 0;
        }

        if (entries.isEmpty()) {
            updateLastRun(0, 0, 0, true, null);
            return 0;
        }

        log.info("Absorbiendo {} entradas del log (cursor {})", entries.size(), cursor);

        long advanced = cursor;
        int inserted = 0;
        int duplicates = 0;
        int skipped = 0;
        try {
            for (LogEntry entry : entries) {
                if (!entry.isValid()) {
                    skipped++;
                    log.warn("Entrada {} del log omitida: {}", entry.getSequence(), entry.getRejectReason());
                } else if (punchRepository.insertIfAbsent(entry.getPunch())) {
                    inserted++;
                } else {
                    duplicates++;
                }
                advanced = Math.max(advanced, entry.getSequence());
            }
        } catch (DataAccessException e) {
            // Sin avance de cursor: la próxima pasada reintenta desde el mismo punto
            log.error("✗ Store no disponible, pasada abortada tras {} inserciones: {}", inserted, e.getMessage());
            updateLastRun(inserted, duplicates, skipped, false, e.getMessage());
            return inserted;
        }

        if (advanced > cursor) {
            try {
                stateStore.put(GatewayStateStore.PROCESSING_CURSOR, advanced);
            } catch (StateStoreException e) {
                log.error("✗ No se pudo persistir el cursor {}: {}", advanced, e.getMessage());
                updateLastRun(inserted, duplicates, skipped, false, e.getMessage());
                return inserted;
            }
        }

        log.info("Pasada del loader completada: {} insertadas, {} ya presentes, {} omitidas, cursor {}",
                inserted, duplicates, skipped, advanced);
        updateLastRun(inserted, duplicates, skipped, true, null);
        return inserted;
    }

    public long getCursor() {
        return stateStore.get(GatewayStateStore.PROCESSING_CURSOR, 0);
    }

    private void updateLastRun(int inserted, int duplicates, int skipped, boolean success, String error) {
        this.lastRunTime = LocalDateTime.now();
        this.lastRunInserted = inserted;
        this.lastRunDuplicates = duplicates;
        this.lastRunSkipped = skipped;
        this.lastRunSuccess = success;
        this.lastRunError = error;
    }
}
