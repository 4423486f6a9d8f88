package ru.xodavit.deadsimple.app;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.xodavit.deadsimple.framework.RawClient;
import ru.xodavit.deadsimple.framework.WebServer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest
{
    private WebServer<Object> server;
    private int port;

    @BeforeEach
    void start() {
        server = Main.create("127.0.0.1:0");
        port = server.bind();
        final var accept = new Thread(() -> server.listen(false));
        accept.setDaemon(true);
        accept.start();
    }

    @AfterEach
    void stop() {
        server.stop();
    }

    @Test
    void root_echoes_query_args() throws IOException {
        assertThat(RawClient.get(port, "/?name=bob"))
                .isEqualTo("HTTP/1.1 200 OK\r\nContent-Type: text/html\r\n\r\n<h1>Hello, World! {name=bob}</h1>");
    }

    @Test
    void give_returns_the_path_value() throws IOException {
        assertThat(RawClient.get(port, "/42/give"))
                .isEqualTo("HTTP/1.1 200 OK\r\nContent-Type: application/json\r\n\r\n{\"YourValue\":\"42\"}");
    }

    @Test
    void gif_route_is_binary() throws IOException {
        final var reply = RawClient.exchange(port, "GET /test HTTP/1.1\r\nHost: h\r\n\r\n".getBytes(StandardCharsets.UTF_8));
        final var head = "HTTP/1.1 200 OK\r\nContent-Type: image/gif\r\n\r\n".getBytes(StandardCharsets.UTF_8);
        assertThat(reply).startsWith(head);
        assertThat(new String(reply, head.length, 6, StandardCharsets.US_ASCII)).isEqualTo("GIF89a");
    }

    @Test
    void unknown_path_hits_404_handler() throws IOException {
        assertThat(RawClient.get(port, "/no/such/page")).endsWith("\r\n\r\n404 :(");
    }
}
