package com.attendpush.application.scheduler;

import com.attendpush.domain.exception.PunchLogException;
import com.attendpush.domain.port.GatewayStateStore;
import com.attendpush.domain.port.PunchLogWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Limpieza diaria del log intermedio: elimina entradas más antiguas que la
 * ventana de retención y que el loader ya absorbió.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LogRetentionJob {

    private final PunchLogWriter logWriter;
    private final GatewayStateStore stateStore;

    @Value("${punchlog.retention-days:30}")
    private int retentionDays;

    @Scheduled(cron = "${punchlog.retention-cron:0 0 3 * * *}")
    public int sweep() {
        if (retentionDays <= 0) {
            return 0;
        }

        LocalDateTime cutoff = LocalDateTime.now().minusDays(retentionDays);
        long absorbed = stateStore.get(GatewayStateStore.PROCESSING_CURSOR, 0);
        try {
            int removed = logWriter.compact(cutoff, absorbed);
            log.info("Retención del log: {} entradas anteriores a {} eliminadas", removed, cutoff.toLocalDate());
            return removed;
        } catch (PunchLogException e) {
            log.error("✗ Error compactando el log intermedio: {}", e.getMessage(), e);
            return 0;
        } catch (RuntimeException e) {
            log.error("Error inesperado en la retención del log: {}", e.getMessage(), e);
            return 0;
        }
    }
}
