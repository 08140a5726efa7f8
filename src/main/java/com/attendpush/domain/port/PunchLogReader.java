package com.attendpush.domain.port;

import com.attendpush.domain.model.LogEntry;

import java.util.List;

/**
 * Puerto (interfaz) para la lectura del log intermedio.
 */
public interface PunchLogReader {

    /**
     * Lee las entradas completas con secuencia mayor a la indicada, en orden.
     *
     * @param afterSequence Cursor de procesamiento
     * @return Entradas pendientes (las inválidas incluidas)
     */
    List<LogEntry> readAfter(long afterSequence);
}
