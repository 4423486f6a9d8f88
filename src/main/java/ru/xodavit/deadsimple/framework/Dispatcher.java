package ru.xodavit.deadsimple.framework;

import lombok.RequiredArgsConstructor;
import lombok.extern.java.Log;

import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.util.Optional;
import java.util.logging.Level;

/**
 * Resolves the route of a parsed request, invokes its handler once and writes the result.
 * <p>
 * An unmatched request falls back to the handler registered as {@code GET 404}; without one, a bare
 * 404 status line is written. A handler that throws gets a generic 500.
 */
@Log
@RequiredArgsConstructor
public class Dispatcher<T> {
    public static final String NOT_FOUND_PATTERN = "404";

    private final RouteTable<T> routes;
    private final SharedState<T> sharedState;
    private final ResponseEncoder encoder;

    public Optional<RouteMatch<T>> resolve(HttpMethod method, String path) {
        return routes.find(method, path)
                .or(() -> routes.find(HttpMethod.GET, NOT_FOUND_PATTERN));
    }

    public void dispatch(ParsedRequest request, Socket connection, OutputStream out) throws IOException {
        final var match = resolve(request.getMethod(), request.getPath());
        if (match.isEmpty()) {
            log.fine(() -> "no route for " + request.getMethod() + " " + request.getPath());
            encoder.writeNotFound(out);
            return;
        }

        final var context = RequestContext.<T>builder()
                .sharedState(sharedState)
                .params(match.get().getParams())
                .args(request.getQuery())
                .body(request.getBody())
                .connection(connection)
                .build();

        final Response response;
        try {
            response = match.get().getHandler().handle(context);
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "handler of " + request.getMethod() + " " + request.getPath() + " failed", e);
            encoder.writeInternalServerError(out);
            return;
        }

        if (response == null) {
            log.warning(() -> "handler of " + request.getMethod() + " " + request.getPath() + " returned no response");
            encoder.writeInternalServerError(out);
            return;
        }
        encoder.encode(response, out);
    }
}
