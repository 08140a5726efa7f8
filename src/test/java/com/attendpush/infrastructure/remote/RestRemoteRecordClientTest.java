package com.attendpush.infrastructure.remote;

import com.attendpush.domain.exception.RemoteSyncException;
import com.attendpush.domain.model.AttendancePunch;
import com.attendpush.domain.model.ForwardStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("RestRemoteRecordClient")
class RestRemoteRecordClientTest {

    private static final String URL = "http://remote.test/api/records";

    private MockRestServiceServer server;
    private RestRemoteRecordClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new RestRemoteRecordClient(restTemplate, URL, "secret-token");
    }

    @Test
    @DisplayName("envía el payload con bearer token y devuelve los identificadores remotos")
    void createsRecord() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer secret-token"))
                .andExpect(jsonPath("$.ZKID").value("1001"))
                .andExpect(jsonPath("$.Timestamp").value("2024/03/05 08:15:30"))
                .andExpect(jsonPath("$.InorOut").value(0))
                .andExpect(jsonPath("$.attype").value(1))
                .andExpect(jsonPath("$.SN").value("ABC123"))
                .andExpect(jsonPath("$.Device").value("Front"))
                .andExpect(jsonPath("$.Devrec").value(""))
                .andRespond(withSuccess("[{\"status\":\"201\",\"key\":\"K-1\",\"id\":\"77\",\"extra\":true}]",
                        MediaType.APPLICATION_JSON));

        ForwardStatus status = client.create(punch());

        assertThat(status).isEqualTo(new ForwardStatus("201", "K-1", "77"));
        server.verify();
    }

    @Test
    @DisplayName("sin status en el acuse usa el código HTTP")
    void statusFallsBackToHttpCode() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("[{\"key\":\"K-1\",\"id\":\"77\"}]", MediaType.APPLICATION_JSON));

        assertThat(client.create(punch()).getStatus()).isEqualTo("200");
    }

    @Test
    @DisplayName("un error del servidor se traduce en RemoteSyncException")
    void serverError() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> client.create(punch())).isInstanceOf(RemoteSyncException.class);
    }

    @Test
    @DisplayName("un arreglo vacío no es un acuse válido")
    void emptyArray() {
        server.expect(requestTo(URL)).andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.create(punch()))
                .isInstanceOf(RemoteSyncException.class)
                .hasMessageContaining("vacío");
    }

    @Test
    @DisplayName("un acuse sin key no es válido")
    void missingKey() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("[{\"status\":\"201\",\"id\":\"77\"}]", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.create(punch()))
                .isInstanceOf(RemoteSyncException.class)
                .hasMessageContaining("key");
    }

    @Test
    @DisplayName("sin URL configurada no está configurado")
    void notConfigured() {
        RestRemoteRecordClient blank = new RestRemoteRecordClient(new RestTemplate(), " ", "");

        assertThat(blank.isConfigured()).isFalse();
        assertThat(client.isConfigured()).isTrue();
    }

    private static AttendancePunch punch() {
        return AttendancePunch.builder()
                .id(5L)
                .externalId("1001")
                .timestamp(LocalDateTime.of(2024, 3, 5, 8, 15, 30))
                .direction(0)
                .eventType(1)
                .deviceSerial("ABC123")
                .deviceLabel("Front")
                .build();
    }
}
