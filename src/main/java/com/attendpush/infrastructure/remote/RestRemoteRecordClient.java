package com.attendpush.infrastructure.remote;

import com.attendpush.domain.exception.RemoteSyncException;
import com.attendpush.domain.model.AttendancePunch;
import com.attendpush.domain.model.ForwardStatus;
import com.attendpush.domain.port.RemoteRecordClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Implementación del puerto RemoteRecordClient sobre RestTemplate.
 * Una llamada por marcación, autenticada con bearer token.
 */
@Component
@Slf4j
public class RestRemoteRecordClient implements RemoteRecordClient {

    private final RestTemplate restTemplate;
    private final String createUrl;
    private final String token;

    public RestRemoteRecordClient(
            RestTemplate remoteRestTemplate,
            @Value("${sync.remote.create-url:}") String createUrl,
            @Value("${sync.remote.token:}") String token) {
        this.restTemplate = remoteRestTemplate;
        this.createUrl = createUrl;
        this.token = token;
    }

    @Override
    public ForwardStatus create(AttendancePunch punch) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (token != null && !token.isBlank()) {
            headers.setBearerAuth(token);
        }

        HttpEntity<RemotePunchPayload> request = new HttpEntity<>(RemotePunchPayload.fromDomain(punch), headers);

        ResponseEntity<RemoteAck[]> response;
        try {
            response = restTemplate.exchange(createUrl, HttpMethod.POST, request, RemoteAck[].class);
        } catch (RestClientException e) {
            throw RemoteSyncException.requestFailed(punch.getId(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw RemoteSyncException.unexpectedStatus(punch.getId(), response.getStatusCode().value());
        }

        RemoteAck[] body = response.getBody();
        if (body == null || body.length == 0 || body[0] == null) {
            throw RemoteSyncException.malformedAck(punch.getId(), "cuerpo vacío");
        }

        RemoteAck ack = body[0];
        if (ack.getKey() == null || ack.getKey().isBlank()) {
            throw RemoteSyncException.malformedAck(punch.getId(), "sin key");
        }

        String status = ack.getStatus() != null
                ? ack.getStatus()
                : String.valueOf(response.getStatusCode().value());

        log.debug("Acuse remoto para marcación {}: status={}, key={}, id={}",
                punch.getId(), status, ack.getKey(), ack.getId());
        return new ForwardStatus(status, ack.getKey(), ack.getId());
    }

    @Override
    public boolean isConfigured() {
        return createUrl != null && !createUrl.isBlank();
    }
}
