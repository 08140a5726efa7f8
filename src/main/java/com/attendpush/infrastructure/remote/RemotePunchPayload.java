package com.attendpush.infrastructure.remote;

import com.attendpush.domain.model.AttendancePunch;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.format.DateTimeFormatter;

/**
 * Cuerpo JSON enviado a la API remota al crear un registro.
 * Los nombres de campo siguen el esquema remoto.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemotePunchPayload {

    static final DateTimeFormatter REMOTE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss");

    @JsonProperty("ZKID")
    private String externalId;

    @JsonProperty("Timestamp")
    private String timestamp;

    @JsonProperty("InorOut")
    private Integer direction;

    @JsonProperty("attype")
    private Integer eventType;

    @JsonProperty("Device")
    private String deviceLabel;

    @JsonProperty("SN")
    private String deviceSerial;

    @JsonProperty("Devrec")
    private String deviceRecordId;

    public static RemotePunchPayload fromDomain(AttendancePunch punch) {
        return RemotePunchPayload.builder()
                .externalId(punch.getExternalId())
                .timestamp(punch.getTimestamp().format(REMOTE_TIMESTAMP))
                .direction(punch.getDirection())
                .eventType(punch.getEventType())
                .deviceLabel(punch.getDeviceLabel())
                .deviceSerial(punch.getDeviceSerial())
                .deviceRecordId(punch.getDeviceRecordId())
                .build();
    }
}
