package ru.xodavit.deadsimple.framework;

import lombok.extern.java.Log;
import ru.xodavit.deadsimple.framework.exception.MalformedRequestException;
import ru.xodavit.deadsimple.framework.guava.Bytes;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns the raw bytes of one connection into a {@link ParsedRequest}.
 * <p>
 * End of request is detected by reading {@value #CHUNK_SIZE}-byte chunks until one comes back short.
 * Content-Length is not consulted, so a request whose size is an exact multiple of the chunk size
 * blocks until the client closes its side.
 */
@Log
public class RequestParser {
    public static final int CHUNK_SIZE = 2048;

    private static final byte[] CRLF = new byte[]{'\r', '\n'};
    private static final byte[] CRLFCRLF = new byte[]{'\r', '\n', '\r', '\n'};

    public byte[] readRequest(InputStream in) throws IOException {
        final var data = new ByteArrayOutputStream();
        final var buffer = new byte[CHUNK_SIZE];
        while (true) {
            final var read = in.read(buffer);
            if (read > 0) {
                data.write(buffer, 0, read);
            }
            if (read != CHUNK_SIZE) {
                break;
            }
        }
        log.fine(() -> "read " + data.size() + " bytes");
        return data.toByteArray();
    }

    public ParsedRequest parse(InputStream in) throws IOException {
        return parse(readRequest(in));
    }

    public ParsedRequest parse(byte[] data) {
        final var requestLineEndIndex = Bytes.indexOf(data, CRLF);
        if (requestLineEndIndex == -1) {
            throw new MalformedRequestException("request line end not found");
        }

        final var requestLineParts = new String(data, 0, requestLineEndIndex, StandardCharsets.UTF_8).split(" ");
        if (requestLineParts.length != 3 || requestLineParts[0].isEmpty() || requestLineParts[1].isEmpty()) {
            throw new MalformedRequestException("request line must contains method, path and version");
        }

        // the request line's own CRLF is the first half of the separator when there are no headers
        final var headersEndIndex = Bytes.indexOf(data, CRLFCRLF, requestLineEndIndex, data.length);
        if (headersEndIndex == -1) {
            throw new MalformedRequestException("headers end not found");
        }

        final var headers = parseHeaders(data, requestLineEndIndex + CRLF.length, headersEndIndex + CRLF.length);
        if (headers.isEmpty()) {
            throw new MalformedRequestException("no header lines");
        }

        final var rawPath = requestLineParts[1];
        final var queryStart = rawPath.indexOf('?');

        return ParsedRequest.builder()
                .method(HttpMethod.parse(requestLineParts[0]))
                .rawPath(rawPath)
                .path(queryStart == -1 ? rawPath : rawPath.substring(0, queryStart))
                .query(queryStart == -1 ? Collections.emptyMap() : parseQuery(rawPath.substring(queryStart + 1)))
                .headers(headers)
                .body(Arrays.copyOfRange(data, headersEndIndex + CRLFCRLF.length, data.length))
                .build();
    }

    /**
     * Splits {@code a=1&b=2} into a map. Tokens without both a name and a value part are dropped and
     * a repeated name keeps its last value. Nothing is URL-decoded.
     */
    public static Map<String, String> parseQuery(String query) {
        final var args = new LinkedHashMap<String, String>();
        for (final var token : query.split("&")) {
            final var nameValue = token.split("=", -1);
            if (nameValue.length < 2) {
                continue;
            }
            args.put(nameValue[0], nameValue[1]);
        }
        return args;
    }

    private static Map<String, String> parseHeaders(byte[] data, int start, int end) {
        final var headers = new LinkedHashMap<String, String>();
        var lastIndex = start;
        while (lastIndex < end) {
            final var headerEndIndex = Bytes.indexOf(data, CRLF, lastIndex, end);
            if (headerEndIndex == -1) {
                throw new MalformedRequestException("can't find header end index");
            }
            final var header = new String(data, lastIndex, headerEndIndex - lastIndex, StandardCharsets.UTF_8);
            final var headerParts = header.split(":", 2);
            if (headerParts.length != 2) {
                throw new MalformedRequestException("Invalid header: " + header);
            }

            headers.put(headerParts[0].trim(), headerParts[1].trim());
            lastIndex = headerEndIndex + CRLF.length;
        }
        return headers;
    }
}
