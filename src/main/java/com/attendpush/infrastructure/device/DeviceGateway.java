package com.attendpush.infrastructure.device;

import com.attendpush.application.dto.ListenerStatusDto;
import com.attendpush.domain.model.DeviceEndpoint;
import com.attendpush.infrastructure.config.GatewayProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.stream.Collectors;

/**
 * Levanta un listener por cada puerto configurado. Varios terminales pueden
 * compartir puerto; se distinguen por serial.
 */
@Component
@Slf4j
public class DeviceGateway {

    private final GatewayProperties properties;
    private final DeviceRequestDispatcher dispatcher;
    private final ThreadPoolExecutor connectionWorkers;
    private final ListenerSettings settings;
    private final boolean enabled;

    private final Map<Integer, DeviceListener> listeners = new LinkedHashMap<>();

    public DeviceGateway(GatewayProperties properties,
            DeviceRequestDispatcher dispatcher,
            ThreadPoolExecutor connectionWorkers,
            @Value("${gateway.enabled:true}") boolean enabled,
            @Value("${gateway.bind.max-attempts:5}") int bindMaxAttempts,
            @Value("${gateway.bind.backoff-ms:2000}") long bindBackoffMs,
            @Value("${gateway.read-timeout-ms:10000}") int readTimeoutMs,
            @Value("${gateway.max-request-bytes:2097152}") int maxRequestBytes) {
        this.properties = properties;
        this.dispatcher = dispatcher;
        this.connectionWorkers = connectionWorkers;
        this.enabled = enabled;
        this.settings = ListenerSettings.builder()
                .host(properties.getHost())
                .bindMaxAttempts(bindMaxAttempts)
                .bindBackoffMs(bindBackoffMs)
                .readTimeoutMs(readTimeoutMs)
                .maxRequestBytes(maxRequestBytes)
                .build();
    }

    @PostConstruct
    public synchronized void start() {
        if (!enabled) {
            log.info("Gateway de terminales deshabilitado (gateway.enabled=false)");
            return;
        }
        if (properties.getDevices().isEmpty()) {
            log.warn("⚠ No hay terminales configurados (gateway.devices)");
            return;
        }

        Map<Integer, List<DeviceEndpoint>> byPort = properties.getDevices().stream()
                .collect(Collectors.groupingBy(DeviceEndpoint::getPort, LinkedHashMap::new, Collectors.toList()));

        byPort.forEach((port, endpoints) -> {
            DeviceListener listener = new DeviceListener(port, endpoints, dispatcher, connectionWorkers, settings);
            listeners.put(port, listener);
            listener.start();
        });
        log.info("Gateway iniciado: {} puertos, {} terminales", byPort.size(), properties.getDevices().size());
    }

    @PreDestroy
    public synchronized void stop() {
        listeners.values().forEach(DeviceListener::stop);
        log.info("Gateway detenido");
    }

    public synchronized List<ListenerStatusDto> getStatuses() {
        List<ListenerStatusDto> statuses = new ArrayList<>();
        for (DeviceListener listener : listeners.values()) {
            statuses.add(ListenerStatusDto.builder()
                    .port(listener.getPort())
                    .boundPort(listener.getBoundPort())
                    .state(listener.getState())
                    .devices(listener.getDeviceNames())
                    .connections(listener.getConnections())
                    .lastError(listener.getLastError())
                    .build());
        }
        return statuses;
    }

    /**
     * Indica si algún terminal configurado usa el puerto.
     */
    public boolean isConfiguredPort(int port) {
        return properties.getDevices().stream().anyMatch(d -> d.getPort() == port);
    }
}
