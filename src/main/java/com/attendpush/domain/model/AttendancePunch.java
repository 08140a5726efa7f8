package com.attendpush.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Modelo de dominio que representa una marcación de asistencia.
 * Objeto de dominio puro, independiente del log intermedio y de la base de
 * datos.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttendancePunch {

    /** Serial usado cuando la petición no permite recuperarlo */
    public static final String UNKNOWN_SERIAL = "unknown";

    /** Largo máximo del id de usuario; forma parte de la clave única del store */
    public static final int MAX_EXTERNAL_ID_LENGTH = 64;

    /** Id sustituto asignado por el store (null hasta que se inserta) */
    private Long id;

    /** Número de secuencia dentro del log intermedio */
    private Long sequence;

    /** Id de usuario asignado por el terminal */
    private String externalId;

    /** Momento de la marcación, tal como lo envía el terminal */
    private LocalDateTime timestamp;

    /** Indicador entrada/salida */
    private Integer direction;

    /** Tipo de evento/asistencia asignado por el terminal */
    private Integer eventType;

    private String deviceSerial;

    private String deviceLabel;

    /** Token de deduplicación local del terminal ("" si no viene) */
    @Builder.Default
    private String deviceRecordId = "";

    /** Campos adicionales de la línea, sin interpretar */
    @Builder.Default
    private List<String> auxiliaryFields = new ArrayList<>();

    /** Momento en que el gateway recibió la marcación */
    private LocalDateTime receivedAt;

    /** Estado del reenvío remoto (null hasta un reenvío exitoso) */
    private ForwardStatus forwardStatus;

    /**
     * Clave de identidad de la marcación.
     */
    public PunchKey key() {
        return PunchKey.of(externalId, timestamp, eventType, deviceRecordId);
    }

    public boolean isForwarded() {
        return forwardStatus != null;
    }
}
