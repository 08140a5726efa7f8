package com.attendpush.infrastructure.device;

import com.attendpush.domain.model.DeviceReply;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Arma la respuesta 200 que esperan los terminales. Content-Length es
 * siempre la longitud en bytes del cuerpo.
 */
public final class DeviceResponseWriter {

    static final DateTimeFormatter HTTP_DATE =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.ENGLISH);

    private DeviceResponseWriter() {
    }

    public static byte[] render(DeviceReply reply, ZonedDateTime now) {
        byte[] body = reply.getBody().getBytes(StandardCharsets.UTF_8);
        String head = "HTTP/1.1 200 OK\r\n"
                + "Content-Type: text/plain\r\n"
                + "Accept-Ranges: bytes\r\n"
                + "Date: " + HTTP_DATE.format(now.withZoneSameInstant(ZoneOffset.UTC)) + "\r\n"
                + "Content-Length: " + body.length + "\r\n"
                + "\r\n";

        byte[] headBytes = head.getBytes(StandardCharsets.US_ASCII);
        byte[] out = new byte[headBytes.length + body.length];
        System.arraycopy(headBytes, 0, out, 0, headBytes.length);
        System.arraycopy(body, 0, out, headBytes.length, body.length);
        return out;
    }

    public static void write(OutputStream out, DeviceReply reply) throws IOException {
        out.write(render(reply, ZonedDateTime.now(ZoneOffset.UTC)));
        out.flush();
    }
}
