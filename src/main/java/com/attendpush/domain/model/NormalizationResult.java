package com.attendpush.domain.model;

import lombok.Value;

/**
 * Conteo de lo ocurrido al normalizar un payload ATTLOG.
 */
@Value
public class NormalizationResult {

    int appended;
    int duplicates;
    int rejected;

    public static NormalizationResult empty() {
        return new NormalizationResult(0, 0, 0);
    }
}
