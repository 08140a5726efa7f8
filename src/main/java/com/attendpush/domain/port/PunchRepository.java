package com.attendpush.domain.port;

import com.attendpush.domain.model.AttendancePunch;
import com.attendpush.domain.model.ForwardStatus;

import java.util.List;

/**
 * Puerto (interfaz) para el store relacional de marcaciones.
 */
public interface PunchRepository {

    /**
     * Inserta la marcación si (externalId, timestamp) no existe aún.
     * Cada inserción confirma su propia transacción.
     *
     * @return true si se insertó, false si ya estaba presente
     */
    boolean insertIfAbsent(AttendancePunch punch);

    /**
     * Filas sin estado de reenvío con id mayor a {@code afterId}, por id ascendente.
     */
    List<AttendancePunch> findPendingForward(long afterId, int limit);

    /**
     * Registra el resultado del reenvío en una sola sentencia. Solo afecta filas
     * que aún no tenían estado de reenvío.
     *
     * @return true si la fila quedó marcada por esta llamada
     */
    boolean markForwarded(long id, ForwardStatus status);

    long countPendingForward();

    long count();
}
