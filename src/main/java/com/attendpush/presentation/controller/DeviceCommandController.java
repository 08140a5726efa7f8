package com.attendpush.presentation.controller;

import com.attendpush.application.service.CommandDispatcher;
import com.attendpush.infrastructure.device.DeviceGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * Controlador REST para encolar comandos a los terminales.
 */
@RestController
@RequestMapping("/api/devices")
@RequiredArgsConstructor
@Slf4j
public class DeviceCommandController {

    private final CommandDispatcher commandDispatcher;
    private final DeviceGateway deviceGateway;

    /**
     * Encola un comando para el puerto indicado. Se entrega en la próxima
     * consulta getrequest del terminal.
     *
     * @param port Puerto del terminal
     * @param body JSON con el campo "command"
     */
    @PostMapping("/{port}/commands")
    public ResponseEntity<Map<String, Object>> enqueueCommand(
            @PathVariable int port,
            @RequestBody Map<String, String> body) {
        Map<String, Object> response = new HashMap<>();

        if (!deviceGateway.isConfiguredPort(port)) {
            log.warn("Comando rechazado: el puerto {} no tiene terminales configurados", port);
            response.put("success", false);
            response.put("message", "Puerto sin terminales configurados: " + port);
            return ResponseEntity.status(404).body(response);
        }

        try {
            int queued = commandDispatcher.enqueue(port, body.get("command"));
            response.put("success", true);
            response.put("port", port);
            response.put("queued", queued);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            log.warn("Comando rechazado para el puerto {}: {}", port, e.getMessage());
            response.put("success", false);
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        }
    }

    @GetMapping("/{port}/commands")
    public ResponseEntity<Map<String, Object>> getPendingCommands(@PathVariable int port) {
        Map<String, Object> response = new HashMap<>();
        response.put("port", port);
        response.put("queued", commandDispatcher.pendingCommands(port));
        response.put("defaultArmed", commandDispatcher.isArmed(port));
        return ResponseEntity.ok(response);
    }
}
