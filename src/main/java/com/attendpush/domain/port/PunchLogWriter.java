package com.attendpush.domain.port;

import com.attendpush.domain.model.AttendancePunch;
import com.attendpush.domain.model.PunchKey;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Puerto (interfaz) para la escritura del log intermedio de marcaciones.
 */
public interface PunchLogWriter {

    /**
     * Agrega al log las marcaciones cuya clave no se haya visto antes.
     * Las nuevas entradas se hacen visibles de forma atómica.
     *
     * @param punches Marcaciones normalizadas
     * @return Marcaciones efectivamente agregadas
     */
    List<AttendancePunch> appendUnseen(List<AttendancePunch> punches);

    /**
     * Indica si una clave ya está presente en el conjunto de vistas.
     */
    boolean isSeen(PunchKey key);

    /**
     * Elimina las entradas recibidas antes de {@code cutoff} que ya fueron
     * absorbidas por el store. Reescribe el log con archivo temporal y rename
     * atómico.
     *
     * @param cutoff       Límite de antigüedad
     * @param absorbedUpTo Secuencia más alta ya absorbida
     * @return Número de entradas eliminadas
     */
    int compact(LocalDateTime cutoff, long absorbedUpTo);

    /**
     * Última secuencia asignada.
     */
    long lastSequence();

    /**
     * Verifica si el writer está inicializado y listo para escribir.
     */
    boolean isReady();
}
