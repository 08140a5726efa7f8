package com.attendpush.domain.model;

import lombok.Value;

/**
 * Identificadores devueltos por la API remota al reenviar una marcación.
 */
@Value
public class ForwardStatus {

    /** Código de estado remoto */
    String status;

    /** Clave remota del registro */
    String key;

    /** Id remoto del registro */
    String remoteId;
}
