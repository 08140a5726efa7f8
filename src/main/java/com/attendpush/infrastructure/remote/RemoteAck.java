package com.attendpush.infrastructure.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Elemento del arreglo que devuelve la API remota al crear un registro.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RemoteAck {

    private String status;
    private String key;
    private String id;
}
