package com.attendpush.application.scheduler;

import com.attendpush.domain.exception.RemoteSyncException;
import com.attendpush.domain.model.AttendancePunch;
import com.attendpush.domain.model.ForwardStatus;
import com.attendpush.domain.port.PunchRepository;
import com.attendpush.domain.port.RemoteRecordClient;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reenvía a la API remota las filas del store que aún no tienen estado de
 * reenvío, en orden de id.
 * El high-water mark solo evita releer filas ya reenviadas; la selección por
 * estado nulo es la que garantiza que cada fila se reenvíe una vez.
 */
@Component
@Slf4j
public class OutboundSyncJob {

    private final PunchRepository punchRepository;
    private final RemoteRecordClient remoteClient;

    @Value("${sync.enabled:true}")
    private boolean enabled;

    @Value("${sync.batch-size:50}")
    private int batchSize;

    private final AtomicLong highWaterMark = new AtomicLong(0);

    @Getter
    private LocalDateTime lastRunTime;
    @Getter
    private int lastRunForwarded;
    @Getter
    private int lastRunFailed;
    @Getter
    private boolean lastRunSuccess;
    @Getter
    private String lastRunError;

    public OutboundSyncJob(PunchRepository punchRepository, RemoteRecordClient remoteClient) {
        this.punchRepository = punchRepository;
        this.remoteClient = remoteClient;
    }

    @Scheduled(fixedDelayString = "${sync.interval-ms:10000}", initialDelayString = "${sync.initial-delay-ms:5000}")
    public void scheduledPass() {
        try {
            runPass();
        } catch (RuntimeException e) {
            log.error("Error inesperado en la sincronización: {}", e.getMessage(), e);
            updateLastRun(0, 0, false, e.getMessage());
        }
    }

    /**
     * Una pasada de reenvío.
     *
     * @return Número de filas marcadas como reenviadas
     */
    public synchronized int runPass() {
        if (!enabled || !remoteClient.isConfigured()) {
            log.debug("Sincronización remota deshabilitada o sin endpoint configurado");
            return 0;
        }

        List<AttendancePunch> pending;
        try {
            pending = punchRepository.findPendingForward(highWaterMark.get(), batchSize);
        } catch (DataAccessException e) {
            log.error("✗ No se pudieron consultar las filas pendientes: {}", e.getMessage());
            updateLastRun(0, 0, false, e.getMessage());
            return 0;
        }

        if (pending.isEmpty()) {
            // Vuelve a empezar desde el principio por si quedó alguna fila atrás
            highWaterMark.set(0);
            updateLastRun(0, 0, true, null);
            return 0;
        }

        int forwarded = 0;
        int failed = 0;
        boolean contiguous = true;

        for (AttendancePunch punch : pending) {
            try {
                ForwardStatus status = remoteClient.create(punch);
                if (punchRepository.markForwarded(punch.getId(), status)) {
                    forwarded++;
                    log.info("✓ Marcación {} reenviada (status={}, key={}, id={})",
                            punch.getId(), status.getStatus(), status.getKey(), status.getRemoteId());
                }
                if (contiguous) {
                    highWaterMark.set(punch.getId());
                }
            } catch (RemoteSyncException e) {
                failed++;
                contiguous = false;
                log.warn("✗ Reenvío de la marcación {} falló, se reintenta en la próxima pasada: {}",
                        punch.getId(), e.getMessage());
            } catch (DataAccessException e) {
                failed++;
                contiguous = false;
                log.error("✗ Acuse remoto recibido para la marcación {} pero no se pudo registrar: {}",
                        punch.getId(), e.getMessage());
            }
        }

        log.info("Sincronización: {} reenviadas, {} fallidas (high-water mark {})",
                forwarded, failed, highWaterMark.get());
        updateLastRun(forwarded, failed, failed == 0, failed > 0 ? failed + " reenvíos fallidos" : null);
        return forwarded;
    }

    public long getHighWaterMark() {
        return highWaterMark.get();
    }

    private void updateLastRun(int forwarded, int failed, boolean success, String error) {
        this.lastRunTime = LocalDateTime.now();
        this.lastRunForwarded = forwarded;
        this.lastRunFailed = failed;
        this.lastRunSuccess = success;
        this.lastRunError = error;
    }
}
