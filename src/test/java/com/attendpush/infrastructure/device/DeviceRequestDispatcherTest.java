package com.attendpush.infrastructure.device;

import com.attendpush.application.service.CommandDispatcher;
import com.attendpush.application.service.PunchNormalizer;
import com.attendpush.domain.model.DeviceReply;
import com.attendpush.domain.model.DeviceRequest;
import com.attendpush.domain.model.IssuedCommand;
import com.attendpush.domain.model.RequestKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DeviceRequestDispatcher")
class DeviceRequestDispatcherTest {

    @Mock
    private CommandDispatcher commandDispatcher;

    @Mock
    private PunchNormalizer punchNormalizer;

    private DeviceRequestDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new DeviceRequestDispatcher(commandDispatcher, punchNormalizer);
    }

    @Nested
    @DisplayName("classify")
    class Classify {

        @Test
        void commandPoll() {
            assertThat(dispatcher.classify(request("GET /iclock/getrequest?SN=A HTTP/1.1")))
                    .isEqualTo(RequestKind.COMMAND_POLL);
        }

        @Test
        void attlogUpload() {
            assertThat(dispatcher.classify(request("POST /iclock/cdata?SN=A&table=ATTLOG&Stamp=1 HTTP/1.1")))
                    .isEqualTo(RequestKind.ATTLOG_UPLOAD);
        }

        @Test
        void operlogUpload() {
            assertThat(dispatcher.classify(request("POST /iclock/cdata?SN=A&table=OPERLOG HTTP/1.1")))
                    .isEqualTo(RequestKind.OPERATION_UPLOAD);
        }

        @Test
        void options() {
            assertThat(dispatcher.classify(request("GET /iclock/cdata?SN=A&options=all HTTP/1.1")))
                    .isEqualTo(RequestKind.OPTIONS);
        }

        @Test
        void commandResult() {
            assertThat(dispatcher.classify(request("POST /iclock/devicecmd?SN=A HTTP/1.1")))
                    .isEqualTo(RequestKind.COMMAND_RESULT);
        }

        @Test
        void other() {
            assertThat(dispatcher.classify(request("GET /favicon.ico HTTP/1.1"))).isEqualTo(RequestKind.OTHER);
            assertThat(dispatcher.classify(request("GET /iclock/cdata?SN=A HTTP/1.1"))).isEqualTo(RequestKind.OTHER);
        }
    }

    @Nested
    @DisplayName("reply")
    class Reply {

        @Test
        @DisplayName("entrega el comando pendiente con su id")
        void pendingCommand() {
            when(commandDispatcher.nextCommand(8081, "A")).thenReturn(Optional.of(
                    new IssuedCommand(1000, 8081, "DATA QUERY ATTLOG", LocalDateTime.now())));

            DeviceReply reply = dispatcher.reply(request("GET /iclock/getrequest?SN=A HTTP/1.1"),
                    RequestKind.COMMAND_POLL, 8081);

            assertThat(reply.getBody()).isEqualTo("C:1000:DATA QUERY ATTLOG");
        }

        @Test
        @DisplayName("sin comando responde OK")
        void noCommand() {
            when(commandDispatcher.nextCommand(8081, "A")).thenReturn(Optional.empty());

            DeviceReply reply = dispatcher.reply(request("GET /iclock/getrequest?SN=A HTTP/1.1"),
                    RequestKind.COMMAND_POLL, 8081);

            assertThat(reply.getBody()).isEqualTo("OK");
        }

        @Test
        @DisplayName("la consulta con INFO no consume comandos")
        void infoPollDoesNotConsume() {
            DeviceReply reply = dispatcher.reply(request("GET /iclock/getrequest?SN=A&INFO=Ver%202.4 HTTP/1.1"),
                    RequestKind.COMMAND_POLL, 8081);

            assertThat(reply.getBody()).isEqualTo("OK");
            verify(commandDispatcher, never()).nextCommand(anyInt(), any());
        }

        @Test
        @DisplayName("options devuelve el documento con el serial")
        void optionsDocument() {
            DeviceReply reply = dispatcher.reply(request("GET /iclock/cdata?SN=ABC123&options=all HTTP/1.1"),
                    RequestKind.OPTIONS, 8081);

            assertThat(reply.getBody()).startsWith("GET OPTION FROM:ABC123");
        }

        @Test
        @DisplayName("las cargas y peticiones desconocidas reciben OK")
        void uploadsAreAcknowledged() {
            DeviceRequest upload = request("POST /iclock/cdata?SN=A&table=ATTLOG HTTP/1.1");

            assertThat(dispatcher.reply(upload, RequestKind.ATTLOG_UPLOAD, 8081).getBody()).isEqualTo("OK");
            assertThat(dispatcher.reply(upload, RequestKind.OTHER, 8081).getBody()).isEqualTo("OK");
            verifyNoInteractions(punchNormalizer);
        }
    }

    @Nested
    @DisplayName("afterReply")
    class AfterReply {

        @Test
        @DisplayName("ATTLOG pasa el cuerpo y el serial al normalizador")
        void attlogGoesToNormalizer() {
            DeviceRequest upload = request("POST /iclock/cdata?SN=ABC123&table=ATTLOG HTTP/1.1", "1001\t2024-03-05 08:00:00\t0\t1");

            dispatcher.afterReply(upload, RequestKind.ATTLOG_UPLOAD, 8081, "Front");

            verify(punchNormalizer).ingest("1001\t2024-03-05 08:00:00\t0\t1", "ABC123", "Front");
        }

        @Test
        @DisplayName("devicecmd pasa el resultado al despachador de comandos")
        void commandResultGoesToDispatcher() {
            DeviceRequest result = request("POST /iclock/devicecmd?SN=ABC123 HTTP/1.1", "ID=1000&Return=0&CMD=DATA");

            dispatcher.afterReply(result, RequestKind.COMMAND_RESULT, 8081, "Front");

            verify(commandDispatcher).handleResult("ID=1000&Return=0&CMD=DATA", 8081);
        }

        @Test
        @DisplayName("OPERLOG no se procesa")
        void operlogIgnored() {
            DeviceRequest upload = request("POST /iclock/cdata?SN=A&table=OPERLOG HTTP/1.1", "OPLOG 4 0 2024-03-05");

            dispatcher.afterReply(upload, RequestKind.OPERATION_UPLOAD, 8081, null);

            verifyNoInteractions(punchNormalizer, commandDispatcher);
        }
    }

    private static DeviceRequest request(String requestLine) {
        return request(requestLine, "");
    }

    private static DeviceRequest request(String requestLine, String body) {
        String raw = requestLine + "\r\nContent-Length: " + body.getBytes(StandardCharsets.UTF_8).length
                + "\r\n\r\n" + body;
        byte[] bytes = raw.getBytes(StandardCharsets.UTF_8);
        return DeviceRequestParser.parse(bytes, bytes.length);
    }
}
