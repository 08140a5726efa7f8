package com.attendpush.infrastructure.config;

import com.attendpush.domain.model.DeviceEndpoint;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Terminales configurados ({@code gateway.devices[n].*}).
 */
@Data
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /** Interfaz donde escuchan los listeners */
    private String host = "0.0.0.0";

    private List<DeviceEndpoint> devices = new ArrayList<>();
}
