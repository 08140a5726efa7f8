package com.attendpush.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Terminal configurado: nombre, puerto donde escucha el gateway y serial
 * esperado (opcional cuando varios terminales comparten puerto).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceEndpoint {

    private String name;

    private int port;

    private String serial;
}
