package com.attendpush.presentation.controller;

import com.attendpush.application.scheduler.OutboundSyncJob;
import com.attendpush.application.scheduler.StoreLoaderJob;
import com.attendpush.application.service.CommandDispatcher;
import com.attendpush.domain.port.PunchLogWriter;
import com.attendpush.domain.port.PunchRepository;
import com.attendpush.infrastructure.device.DeviceGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Controlador REST para consultar el estado completo del gateway.
 */
@RestController
@RequestMapping("/api/system")
@RequiredArgsConstructor
@Slf4j
public class SystemStatusController {

    private final DeviceGateway deviceGateway;
    private final StoreLoaderJob storeLoaderJob;
    private final OutboundSyncJob outboundSyncJob;
    private final CommandDispatcher commandDispatcher;
    private final PunchLogWriter punchLogWriter;
    private final PunchRepository punchRepository;

    /**
     * GET /api/system/status
     * Devuelve el estado completo del gateway en un solo JSON.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getSystemStatus() {
        Map<String, Object> status = new LinkedHashMap<>();

        // Listeners
        status.put("listeners", deviceGateway.getStatuses());

        // Log intermedio
        Map<String, Object> punchLog = new LinkedHashMap<>();
        punchLog.put("ready", punchLogWriter.isReady());
        punchLog.put("lastSequence", punchLogWriter.lastSequence());
        status.put("punchLog", punchLog);

        // Loader
        Map<String, Object> loader = new LinkedHashMap<>();
        loader.put("cursor", storeLoaderJob.getCursor());
        loader.put("lastRunTime", format(storeLoaderJob.getLastRunTime()));
        loader.put("lastRunInserted", storeLoaderJob.getLastRunInserted());
        loader.put("lastRunDuplicates", storeLoaderJob.getLastRunDuplicates());
        loader.put("lastRunSkipped", storeLoaderJob.getLastRunSkipped());
        loader.put("lastRunSuccess", storeLoaderJob.isLastRunSuccess());
        loader.put("lastRunError", storeLoaderJob.getLastRunError());
        status.put("loader", loader);

        // Sincronización remota
        Map<String, Object> sync = new LinkedHashMap<>();
        sync.put("highWaterMark", outboundSyncJob.getHighWaterMark());
        sync.put("lastRunTime", format(outboundSyncJob.getLastRunTime()));
        sync.put("lastRunForwarded", outboundSyncJob.getLastRunForwarded());
        sync.put("lastRunFailed", outboundSyncJob.getLastRunFailed());
        sync.put("lastRunSuccess", outboundSyncJob.isLastRunSuccess());
        sync.put("lastRunError", outboundSyncJob.getLastRunError());
        status.put("sync", sync);

        // Store
        Map<String, Object> store = new LinkedHashMap<>();
        try {
            store.put("rows", punchRepository.count());
            store.put("pendingForward", punchRepository.countPendingForward());
            store.put("available", true);
        } catch (DataAccessException e) {
            log.warn("Store no disponible al consultar estado: {}", e.getMessage());
            store.put("available", false);
        }
        status.put("store", store);

        status.put("nextCommandId", commandDispatcher.peekNextId());
        status.put("serverTime", LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));

        return ResponseEntity.ok(status);
    }

    /**
     * POST /api/system/loader/run
     * Ejecuta una pasada del loader fuera de agenda.
     */
    @PostMapping("/loader/run")
    public ResponseEntity<Map<String, Object>> runLoader() {
        log.info("Ejecutando pasada del loader manualmente...");
        int inserted = storeLoaderJob.runPass();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", storeLoaderJob.isLastRunSuccess());
        response.put("inserted", inserted);
        response.put("cursor", storeLoaderJob.getCursor());
        response.put("error", storeLoaderJob.getLastRunError());
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/system/sync/run
     * Ejecuta una pasada de reenvío fuera de agenda.
     */
    @PostMapping("/sync/run")
    public ResponseEntity<Map<String, Object>> runSync() {
        log.info("Ejecutando sincronización manualmente...");
        int forwarded = outboundSyncJob.runPass();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("forwarded", forwarded);
        response.put("failed", outboundSyncJob.getLastRunFailed());
        response.put("highWaterMark", outboundSyncJob.getHighWaterMark());
        return ResponseEntity.ok(response);
    }

    private static String format(LocalDateTime time) {
        return time != null ? time.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME) : null;
    }
}
