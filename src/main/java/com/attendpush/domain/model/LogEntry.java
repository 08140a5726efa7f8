package com.attendpush.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Entrada leída del log intermedio. Una entrada inválida conserva su número de
 * secuencia para que el cursor pueda avanzar sobre ella.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class LogEntry {

    private final long sequence;
    private final AttendancePunch punch;
    private final String rejectReason;

    public static LogEntry valid(long sequence, AttendancePunch punch) {
        return new LogEntry(sequence, punch, null);
    }

    public static LogEntry invalid(long sequence, String reason) {
        return new LogEntry(sequence, null, reason);
    }

    public boolean isValid() {
        return punch != null;
    }
}
