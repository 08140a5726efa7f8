package com.attendpush.domain.port;

import com.attendpush.domain.model.AttendancePunch;
import com.attendpush.domain.model.ForwardStatus;

/**
 * Puerto (interfaz) hacia la API remota de agregación.
 */
public interface RemoteRecordClient {

    /**
     * Crea el registro remoto de una marcación.
     *
     * @return Identificadores asignados por la API remota
     * @throws com.attendpush.domain.exception.RemoteSyncException si la llamada
     *         falla o el acuse no es válido
     */
    ForwardStatus create(AttendancePunch punch);

    /**
     * Indica si hay un endpoint remoto configurado.
     */
    boolean isConfigured();
}
