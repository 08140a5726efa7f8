package com.attendpush.infrastructure.persistence.entity;

import com.attendpush.domain.model.AttendancePunch;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entidad JPA que mapea a la tabla attendance.
 * La restricción única (external_id, punch_time) es la que hace idempotente
 * la carga desde el log intermedio.
 */
@Entity
@Table(name = "attendance", uniqueConstraints = @UniqueConstraint(
        name = "uk_attendance_external_time", columnNames = { "external_id", "punch_time" }))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PunchEntity {

    public static final int DEVICE_SERIAL_LENGTH = 64;
    public static final int DEVICE_LABEL_LENGTH = 100;
    public static final int DEVICE_RECORD_ID_LENGTH = 64;
    public static final int AUXILIARY_LENGTH = 500;
    public static final int FORWARD_STATUS_LENGTH = 50;
    public static final int FORWARD_KEY_LENGTH = 255;
    public static final int FORWARD_ID_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "external_id", nullable = false, length = AttendancePunch.MAX_EXTERNAL_ID_LENGTH)
    private String externalId;

    @Column(name = "punch_time", nullable = false)
    private LocalDateTime punchTime;

    @Column(name = "direction", nullable = false)
    private Integer direction;

    @Column(name = "event_type", nullable = false)
    private Integer eventType;

    @Column(name = "device_serial", length = DEVICE_SERIAL_LENGTH)
    private String deviceSerial;

    @Column(name = "device_label", length = DEVICE_LABEL_LENGTH)
    private String deviceLabel;

    @Column(name = "device_record_id", length = DEVICE_RECORD_ID_LENGTH)
    private String deviceRecordId;

    @Column(name = "auxiliary", length = AUXILIARY_LENGTH)
    private String auxiliary;

    @Column(name = "log_sequence")
    private Long logSequence;

    @Column(name = "received_at")
    private LocalDateTime receivedAt;

    // Resultado del reenvío remoto; null mientras esté pendiente
    @Column(name = "forward_status", length = FORWARD_STATUS_LENGTH)
    private String forwardStatus;

    @Column(name = "forward_key", length = FORWARD_KEY_LENGTH)
    private String forwardKey;

    @Column(name = "forward_id", length = FORWARD_ID_LENGTH)
    private String forwardId;

    @Column(name = "forwarded_at")
    private LocalDateTime forwardedAt;
}
