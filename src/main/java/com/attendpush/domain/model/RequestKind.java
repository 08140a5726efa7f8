package com.attendpush.domain.model;

/**
 * Tipos de petición que envía un terminal.
 */
public enum RequestKind {

    /** GET .../getrequest: el terminal pregunta si hay un comando pendiente */
    COMMAND_POLL,

    /** POST .../cdata con table=ATTLOG: subida masiva de marcaciones */
    ATTLOG_UPLOAD,

    /** POST .../cdata con cualquier otra tabla (OPERLOG, etc.) */
    OPERATION_UPLOAD,

    /** POST .../devicecmd: resultado de un comando emitido */
    COMMAND_RESULT,

    /** GET .../cdata?options=all: negociación de capacidades */
    OPTIONS,

    OTHER
}
