package com.attendpush.application.service;

import com.attendpush.domain.exception.StateStoreException;
import com.attendpush.domain.model.AttendancePunch;
import com.attendpush.domain.model.CommandResult;
import com.attendpush.domain.model.IssuedCommand;
import com.attendpush.domain.port.GatewayStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Cola de comandos por puerto y contador global de ids de comando.
 *
 * Cada terminal, identificado por puerto y serial, queda "armado" con el
 * comando por defecto una vez por ciclo; los comandos agregados por un
 * operador para el puerto salen primero, en orden FIFO, uno por consulta. El siguiente id se persiste antes de entregar
 * el comando, así un reinicio nunca reutiliza un id.
 */
@Service
@Slf4j
public class CommandDispatcher {

    static final long INITIAL_COMMAND_ID = 1000;

    private final GatewayStateStore stateStore;
    private final String defaultTemplate;
    private final ZoneOffset zone;

    private final Map<Integer, Deque<String>> queued = new ConcurrentHashMap<>();
    private final Set<DeviceSlot> armedDevices = ConcurrentHashMap.newKeySet();
    private final Set<DeviceSlot> knownDevices = ConcurrentHashMap.newKeySet();
    private final Map<Long, IssuedCommand> issued = new ConcurrentHashMap<>();
    private final Object counterLock = new Object();

    private Clock clock = Clock.systemUTC();

    public CommandDispatcher(
            GatewayStateStore stateStore,
            @Value("${gateway.command.template:DATA QUERY ATTLOG StartTime={yesterday}\tEndTime={today}}") String defaultTemplate,
            @Value("${gateway.command.zone:+02:00}") String zone) {
        this.stateStore = stateStore;
        this.defaultTemplate = defaultTemplate;
        this.zone = ZoneOffset.of(zone);
    }

    /**
     * Entrega el siguiente comando para el terminal que consulta, si hay uno.
     *
     * @param serial Serial declarado en la consulta; null cuenta como un
     *               terminal sin serial en ese puerto
     */
    public Optional<IssuedCommand> nextCommand(int port, String serial) {
        DeviceSlot device = DeviceSlot.of(port, serial);
        synchronized (counterLock) {
            if (knownDevices.add(device) && hasDefaultCommand()) {
                armedDevices.add(device);
            }

            Deque<String> queue = queued.get(port);
            String text = queue != null ? queue.pollFirst() : null;
            boolean adHoc = text != null;
            if (!adHoc) {
                if (!armedDevices.remove(device)) {
                    return Optional.empty();
                }
                text = defaultTemplate;
            }

            long id = stateStore.get(GatewayStateStore.NEXT_COMMAND_ID, INITIAL_COMMAND_ID);
            try {
                stateStore.put(GatewayStateStore.NEXT_COMMAND_ID, id + 1);
            } catch (StateStoreException e) {
                // Sin contador persistido no se entrega; queda para la próxima consulta
                if (adHoc) {
                    queue.offerFirst(text);
                } else {
                    armedDevices.add(device);
                }
                log.error("✗ No se pudo persistir el contador de comandos: {}", e.getMessage());
                return Optional.empty();
            }

            IssuedCommand command = new IssuedCommand(id, port, render(text), LocalDateTime.now(clock));
            issued.put(id, command);
            log.info("Comando {} entregado a {} en el puerto {}: {}", id, device.serial, port, command.getText());
            return Optional.of(command);
        }
    }

    /**
     * Agrega un comando a la cola del puerto.
     *
     * @return Tamaño de la cola después de agregarlo
     */
    public int enqueue(int port, String commandText) {
        if (commandText == null || commandText.isBlank()) {
            throw new IllegalArgumentException("El comando no puede estar vacío");
        }
        if (commandText.contains("\n") || commandText.contains("\r")) {
            throw new IllegalArgumentException("El comando debe ser una sola línea");
        }
        Deque<String> queue = queued.computeIfAbsent(port, p -> new ConcurrentLinkedDeque<>());
        queue.addLast(commandText.trim());
        log.info("Comando encolado para el puerto {}: {}", port, commandText.trim());
        return queue.size();
    }

    public List<String> pendingCommands(int port) {
        Deque<String> queue = queued.get(port);
        return queue == null ? List.of() : new ArrayList<>(queue);
    }

    /**
     * Indica si algún terminal del puerto tiene pendiente el comando por
     * defecto. Un puerto sin consultas todavía cuenta como armado.
     */
    public boolean isArmed(int port) {
        boolean anyKnown = knownDevices.stream().anyMatch(d -> d.port == port);
        return armedDevices.stream().anyMatch(d -> d.port == port) || (!anyKnown && hasDefaultCommand());
    }

    /**
     * Procesa el cuerpo de un POST devicecmd: una línea por comando con
     * {@code ID=<id>&Return=<código>&CMD=<comando>}.
     */
    public List<CommandResult> handleResult(String body, int port) {
        List<CommandResult> results = new ArrayList<>();
        if (body == null) {
            return results;
        }

        for (String line : body.split("\\r?\\n")) {
            if (line.isBlank()) {
                continue;
            }
            CommandResult result = parseResult(line.trim());
            if (result == null) {
                log.warn("Resultado de comando ilegible en el puerto {}: {}", port, line);
                continue;
            }
            results.add(result);
            acknowledge(result, port);
        }
        return results;
    }

    /**
     * Rearma el comando por defecto en todos los terminales conocidos y descarta
     * los comandos entregados hace más de un ciclo sin respuesta.
     */
    @Scheduled(fixedDelayString = "${gateway.command.cycle-ms:43200000}",
            initialDelayString = "${gateway.command.cycle-ms:43200000}")
    public void rearmCycle() {
        if (hasDefaultCommand()) {
            armedDevices.addAll(knownDevices);
        }
        LocalDateTime limit = LocalDateTime.now(clock).minusDays(1);
        issued.values().removeIf(cmd -> cmd.getIssuedAt().isBefore(limit));
        log.info("Ciclo de comandos: {} terminales rearmados, {} comandos sin respuesta", armedDevices.size(), issued.size());
    }

    public long peekNextId() {
        return stateStore.get(GatewayStateStore.NEXT_COMMAND_ID, INITIAL_COMMAND_ID);
    }

    public Map<Long, IssuedCommand> getIssued() {
        return Collections.unmodifiableMap(issued);
    }

    void setClock(Clock clock) {
        this.clock = clock;
    }

    /**
     * Sustituye {today} y {yesterday} por fechas yyyy-MM-dd en la zona
     * configurada.
     */
    String render(String text) {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        return text
                .replace("{today}", today.toString())
                .replace("{yesterday}", today.minusDays(1).toString());
    }

    private void acknowledge(CommandResult result, int port) {
        IssuedCommand command = issued.remove(result.getId());
        if (command == null) {
            log.warn("Resultado para el comando {} no emitido en esta sesión (puerto {})", result.getId(), port);
        }

        if (!result.isSuccess()) {
            log.warn("Comando {} falló en el puerto {} con código {}", result.getId(), port, result.getReturnCode());
            return;
        }

        synchronized (counterLock) {
            long lastAcked = stateStore.get(GatewayStateStore.LAST_ACKED_COMMAND_ID, 0);
            if (result.getId() <= lastAcked) {
                return;
            }
            try {
                stateStore.put(GatewayStateStore.LAST_ACKED_COMMAND_ID, result.getId());
                log.info("✓ Comando {} confirmado por el puerto {}", result.getId(), port);
            } catch (StateStoreException e) {
                log.error("✗ No se pudo persistir la confirmación del comando {}: {}", result.getId(), e.getMessage());
            }
        }
    }

    private static CommandResult parseResult(String line) {
        Map<String, String> fields = new HashMap<>();
        for (String pair : line.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                fields.put(pair.substring(0, eq).trim().toUpperCase(Locale.ROOT), pair.substring(eq + 1).trim());
            }
        }
        try {
            long id = Long.parseLong(fields.get("ID"));
            int code = Integer.parseInt(fields.get("RETURN"));
            return new CommandResult(id, code, fields.getOrDefault("CMD", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private boolean hasDefaultCommand() {
        return defaultTemplate != null && !defaultTemplate.isBlank();
    }

    /**
     * Terminal dentro de un puerto compartido.
     */
    private static final class DeviceSlot {
        final int port;
        final String serial;

        private DeviceSlot(int port, String serial) {
            this.port = port;
            this.serial = serial;
        }

        static DeviceSlot of(int port, String serial) {
            String normalized = serial == null || serial.isBlank()
                    ? AttendancePunch.UNKNOWN_SERIAL
                    : serial.trim().toUpperCase(Locale.ROOT);
            return new DeviceSlot(port, normalized);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof DeviceSlot)) {
                return false;
            }
            DeviceSlot other = (DeviceSlot) o;
            return port == other.port && serial.equals(other.serial);
        }

        @Override
        public int hashCode() {
            return Objects.hash(port, serial);
        }
    }
}
