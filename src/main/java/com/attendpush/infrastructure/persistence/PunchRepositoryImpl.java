package com.attendpush.infrastructure.persistence;

import com.attendpush.domain.model.AttendancePunch;
import com.attendpush.domain.model.ForwardStatus;
import com.attendpush.domain.port.PunchRepository;
import com.attendpush.infrastructure.persistence.entity.PunchEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Implementación del puerto PunchRepository usando JPA.
 * Cada inserción y cada marca de reenvío confirman su propia transacción.
 */
@Component
@Slf4j
public class PunchRepositoryImpl implements PunchRepository {

    private final JpaPunchRepository punchRepository;
    private final TransactionTemplate transactionTemplate;

    public PunchRepositoryImpl(JpaPunchRepository punchRepository, PlatformTransactionManager transactionManager) {
        this.punchRepository = punchRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public boolean insertIfAbsent(AttendancePunch punch) {
        try {
            Boolean inserted = transactionTemplate.execute(status -> {
                if (punchRepository.existsByExternalIdAndPunchTime(punch.getExternalId(), punch.getTimestamp())) {
                    return false;
                }
                PunchEntity saved = punchRepository.saveAndFlush(toEntity(punch));
                punch.setId(saved.getId());
                return true;
            });
            return Boolean.TRUE.equals(inserted);

        } catch (DataIntegrityViolationException e) {
            // Solo la restricción única significa "ya presente": la fila tiene que existir
            Boolean present = transactionTemplate.execute(status ->
                    punchRepository.existsByExternalIdAndPunchTime(punch.getExternalId(), punch.getTimestamp()));
            if (Boolean.TRUE.equals(present)) {
                log.info("Marcación ya presente en el store: {} @ {}", punch.getExternalId(), punch.getTimestamp());
                return false;
            }
            log.error("✗ La marcación {} @ {} viola una restricción distinta de la clave única: {}",
                    punch.getExternalId(), punch.getTimestamp(), e.getMostSpecificCause().getMessage());
            throw e;
        }
    }

    @Override
    public List<AttendancePunch> findPendingForward(long afterId, int limit) {
        return punchRepository.findByForwardStatusIsNullAndIdGreaterThanOrderByIdAsc(afterId, PageRequest.of(0, limit))
                .stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public boolean markForwarded(long id, ForwardStatus status) {
        String remoteStatus = fit(status.getStatus(), PunchEntity.FORWARD_STATUS_LENGTH, "status", id);
        String remoteKey = fit(status.getKey(), PunchEntity.FORWARD_KEY_LENGTH, "key", id);
        String remoteId = fit(status.getRemoteId(), PunchEntity.FORWARD_ID_LENGTH, "id", id);

        Integer updated = transactionTemplate.execute(tx -> punchRepository.markForwarded(
                id, remoteStatus, remoteKey, remoteId, LocalDateTime.now()));
        if (updated == null || updated == 0) {
            log.warn("La marcación {} ya tenía estado de reenvío, no se sobrescribe", id);
            return false;
        }
        return true;
    }

    @Override
    public long countPendingForward() {
        return punchRepository.countByForwardStatusIsNull();
    }

    @Override
    public long count() {
        return punchRepository.count();
    }

    /**
     * Convierte una marcación de dominio a una entidad JPA.
     */
    private PunchEntity toEntity(AttendancePunch punch) {
        return PunchEntity.builder()
                .externalId(punch.getExternalId())
                .punchTime(punch.getTimestamp())
                .direction(punch.getDirection())
                .eventType(punch.getEventType())
                .deviceSerial(truncate(punch.getDeviceSerial(), PunchEntity.DEVICE_SERIAL_LENGTH))
                .deviceLabel(truncate(punch.getDeviceLabel(), PunchEntity.DEVICE_LABEL_LENGTH))
                .deviceRecordId(truncate(punch.getDeviceRecordId(), PunchEntity.DEVICE_RECORD_ID_LENGTH))
                .auxiliary(truncate(String.join(" ", punch.getAuxiliaryFields()), PunchEntity.AUXILIARY_LENGTH))
                .logSequence(punch.getSequence())
                .receivedAt(punch.getReceivedAt())
                .build();
    }

    /**
     * Convierte una entidad JPA a una marcación de dominio.
     */
    private AttendancePunch toDomain(PunchEntity entity) {
        ForwardStatus forward = entity.getForwardStatus() == null
                ? null
                : new ForwardStatus(entity.getForwardStatus(), entity.getForwardKey(), entity.getForwardId());

        List<String> auxiliary = entity.getAuxiliary() == null || entity.getAuxiliary().isBlank()
                ? new ArrayList<>()
                : new ArrayList<>(Arrays.asList(entity.getAuxiliary().split(" ")));

        return AttendancePunch.builder()
                .id(entity.getId())
                .sequence(entity.getLogSequence())
                .externalId(entity.getExternalId())
                .timestamp(entity.getPunchTime())
                .direction(entity.getDirection())
                .eventType(entity.getEventType())
                .deviceSerial(entity.getDeviceSerial())
                .deviceLabel(entity.getDeviceLabel())
                .deviceRecordId(entity.getDeviceRecordId())
                .auxiliaryFields(auxiliary)
                .receivedAt(entity.getReceivedAt())
                .forwardStatus(forward)
                .build();
    }

    /**
     * Recorta un identificador remoto al largo de su columna. El valor completo
     * queda en el log.
     */
    private static String fit(String value, int max, String field, long id) {
        if (value != null && value.length() > max) {
            log.warn("⚠ El {} remoto de la marcación {} supera {} caracteres y se recorta: {}", field, id, max, value);
        }
        return truncate(value, max);
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
