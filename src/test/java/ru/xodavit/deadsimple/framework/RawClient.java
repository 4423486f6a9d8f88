package ru.xodavit.deadsimple.framework;

import java.io.IOException;
import java.net.InetAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Writes one raw request over loopback and reads the reply until the server closes the connection.
 */
public final class RawClient {
    private static final int TIMEOUT_MILLIS = 10_000;

    private RawClient() {
    }

    public static byte[] exchange(int port, byte[] request) throws IOException {
        try (final var socket = new Socket(InetAddress.getLoopbackAddress(), port)) {
            socket.setSoTimeout(TIMEOUT_MILLIS);
            final var out = socket.getOutputStream();
            out.write(request);
            out.flush();
            return socket.getInputStream().readAllBytes();
        }
    }

    public static String exchange(int port, String request) throws IOException {
        return new String(exchange(port, request.getBytes(StandardCharsets.UTF_8)), StandardCharsets.UTF_8);
    }

    public static String get(int port, String path) throws IOException {
        return exchange(port, "GET " + path + " HTTP/1.1\r\nHost: localhost\r\n\r\n");
    }

    public static String post(int port, String path, String body) throws IOException {
        return exchange(port,
                "POST " + path + " HTTP/1.1\r\n" +
                        "Host: localhost\r\n" +
                        "Content-Type: application/json\r\n" +
                        "Content-Length: " + body.getBytes(StandardCharsets.UTF_8).length + "\r\n" +
                        "\r\n" +
                        body);
    }
}
