package com.attendpush.domain.model;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * Clave de deduplicación de una marcación: (externalId, timestamp, eventType),
 * refinada por el deviceRecordId cuando el terminal lo envía.
 */
@Value
public class PunchKey {

    String externalId;
    LocalDateTime timestamp;
    Integer eventType;
    String deviceRecordId;

    public static PunchKey of(String externalId, LocalDateTime timestamp, Integer eventType, String deviceRecordId) {
        return new PunchKey(externalId, timestamp, eventType, deviceRecordId == null ? "" : deviceRecordId);
    }
}
