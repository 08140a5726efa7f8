package com.attendpush.infrastructure.device;

import com.attendpush.application.service.CommandDispatcher;
import com.attendpush.application.service.PunchNormalizer;
import com.attendpush.domain.model.DeviceReply;
import com.attendpush.domain.model.DeviceRequest;
import com.attendpush.domain.model.RequestKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Clasifica las peticiones de los terminales y decide la respuesta.
 * El procesamiento pesado (ATTLOG, resultados de comando) se hace en
 * {@link #afterReply} para que el terminal reciba su acuse primero.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeviceRequestDispatcher {

    private final CommandDispatcher commandDispatcher;
    private final PunchNormalizer punchNormalizer;

    public RequestKind classify(DeviceRequest request) {
        String path = request.getPath() == null ? "" : request.getPath().toLowerCase(Locale.ROOT);

        if (path.contains("getrequest") && request.isGet()) {
            return RequestKind.COMMAND_POLL;
        }
        if (path.contains("devicecmd") && request.isPost()) {
            return RequestKind.COMMAND_RESULT;
        }
        if (path.contains("cdata")) {
            if (request.isGet() && request.paramIgnoreCase("options") != null) {
                return RequestKind.OPTIONS;
            }
            if (request.isPost()) {
                String table = request.paramIgnoreCase("table");
                return "ATTLOG".equalsIgnoreCase(table) ? RequestKind.ATTLOG_UPLOAD : RequestKind.OPERATION_UPLOAD;
            }
        }
        return RequestKind.OTHER;
    }

    public DeviceReply reply(DeviceRequest request, RequestKind kind, int port) {
        switch (kind) {
            case COMMAND_POLL:
                // La consulta con INFO solo informa datos del terminal
                if (request.paramIgnoreCase("INFO") != null) {
                    log.debug("INFO de {} en puerto {}: {}", request.getSerial(), port, request.paramIgnoreCase("INFO"));
                    return DeviceReply.ack();
                }
                return commandDispatcher.nextCommand(port, request.getSerial())
                        .map(cmd -> DeviceReply.of(cmd.toWireFormat()))
                        .orElseGet(DeviceReply::ack);
            case OPTIONS:
                return DeviceReply.of(DeviceOptions.render(request.getSerial()));
            default:
                return DeviceReply.ack();
        }
    }

    public void afterReply(DeviceRequest request, RequestKind kind, int port, String deviceLabel) {
        switch (kind) {
            case ATTLOG_UPLOAD:
                punchNormalizer.ingest(request.getBody(), request.getSerial(), deviceLabel);
                break;
            case COMMAND_RESULT:
                commandDispatcher.handleResult(request.getBody(), port);
                break;
            case OPERATION_UPLOAD:
                log.debug("Carga {} de {} ignorada ({} bytes)",
                        request.paramIgnoreCase("table"), request.getSerial(), request.getBody().length());
                break;
            default:
                break;
        }
    }
}
