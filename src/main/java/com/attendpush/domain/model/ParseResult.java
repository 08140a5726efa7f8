package com.attendpush.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Resultado de tokenizar una línea ATTLOG: una marcación o el motivo del
 * rechazo.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ParseResult {

    private final AttendancePunch punch;
    private final String reason;
    private final String line;

    public static ParseResult ok(AttendancePunch punch, String line) {
        return new ParseResult(punch, null, line);
    }

    public static ParseResult error(String reason, String line) {
        return new ParseResult(null, reason, line);
    }

    public boolean isOk() {
        return punch != null;
    }
}
