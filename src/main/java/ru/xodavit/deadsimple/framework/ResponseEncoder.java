package ru.xodavit.deadsimple.framework;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.java.Log;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes a {@link Response} onto a connection: {@code HTTP/1.1 200 OK}, one Content-Type header, a
 * blank line and the payload. No other header is ever written. A response without a content type
 * (every {@code ERROR}) is answered with {@link #INTERNAL_SERVER_ERROR} whatever its error kind, and so
 * is a JSON payload that fails to serialize. Nothing is written before the payload is ready.
 */
@Log
public class ResponseEncoder {
    // language=HTTP
    static final String INTERNAL_SERVER_ERROR = "HTTP/1.1 500 INTERNAL SERVER ERROR\r\n\r\n";
    // language=HTTP
    static final String NOT_FOUND = "HTTP/1.1 404 NOT FOUND\r\n\r\n";

    public void encode(Response response, OutputStream out) throws IOException {
        final var contentType = response.getType().contentType();
        if (contentType.isEmpty()) {
            writeInternalServerError(out);
            return;
        }

        final byte[] payload;
        try {
            payload = payload(response);
        } catch (JsonProcessingException e) {
            log.warning(() -> "can't serialize " + response + ": " + e.getMessage());
            writeInternalServerError(out);
            return;
        }

        out.write(
                (
                        // language=HTTP
                        "HTTP/1.1 200 OK\r\n" +
                                "Content-Type: " + contentType.get() + "\r\n" +
                                "\r\n"
                ).getBytes(StandardCharsets.UTF_8)
        );
        out.write(payload);
        out.flush();
    }

    public void writeInternalServerError(OutputStream out) throws IOException {
        out.write(INTERNAL_SERVER_ERROR.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    public void writeNotFound(OutputStream out) throws IOException {
        out.write(NOT_FOUND.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private static byte[] payload(Response response) throws JsonProcessingException {
        if (response.getType() == ResponseType.JSON) {
            return Response.MAPPER.writeValueAsBytes(response.getJson());
        }
        if (response.getType().isBinary()) {
            return response.getBytes();
        }
        return response.getText().getBytes(StandardCharsets.UTF_8);
    }
}
