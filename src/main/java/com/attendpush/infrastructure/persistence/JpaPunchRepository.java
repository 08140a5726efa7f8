package com.attendpush.infrastructure.persistence;

import com.attendpush.infrastructure.persistence.entity.PunchEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repositorio JPA para operaciones con attendance.
 */
@Repository
public interface JpaPunchRepository extends JpaRepository<PunchEntity, Long> {

    boolean existsByExternalIdAndPunchTime(String externalId, LocalDateTime punchTime);

    /**
     * Filas pendientes de reenvío después de un id, en orden de inserción.
     */
    List<PunchEntity> findByForwardStatusIsNullAndIdGreaterThanOrderByIdAsc(Long afterId, Pageable page);

    long countByForwardStatusIsNull();

    /**
     * Registra el acuse remoto. La condición sobre forwardStatus evita
     * sobrescribir una fila ya reenviada.
     */
    @Modifying
    @Query("UPDATE PunchEntity p SET p.forwardStatus = :status, p.forwardKey = :forwardKey, "
            + "p.forwardId = :forwardId, p.forwardedAt = :forwardedAt "
            + "WHERE p.id = :id AND p.forwardStatus IS NULL")
    int markForwarded(
            @Param("id") Long id,
            @Param("status") String status,
            @Param("forwardKey") String forwardKey,
            @Param("forwardId") String forwardId,
            @Param("forwardedAt") LocalDateTime forwardedAt);
}
