package com.attendpush.domain.model;

import lombok.Value;

/**
 * Resultado de un comando informado por el terminal
 * ({@code ID=<id>&Return=<código>&CMD=<comando>}).
 */
@Value
public class CommandResult {

    long id;
    int returnCode;
    String command;

    public boolean isSuccess() {
        return returnCode == 0;
    }
}
