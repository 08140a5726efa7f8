package com.attendpush.application.dto;

import com.attendpush.domain.model.ListenerState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO con el estado de un listener de terminales.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListenerStatusDto {

    private int port;
    private Integer boundPort;
    private ListenerState state;
    private List<String> devices;
    private long connections;
    private String lastError;
}
