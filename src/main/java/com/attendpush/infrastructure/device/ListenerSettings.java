package com.attendpush.infrastructure.device;

import lombok.Builder;
import lombok.Value;

/**
 * Parámetros comunes a todos los listeners.
 */
@Value
@Builder
public class ListenerSettings {

    String host;
    int bindMaxAttempts;
    long bindBackoffMs;
    int readTimeoutMs;
    int maxRequestBytes;
}
