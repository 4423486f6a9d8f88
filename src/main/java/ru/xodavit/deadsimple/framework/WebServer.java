package ru.xodavit.deadsimple.framework;

import io.github.classgraph.ClassGraph;
import io.github.classgraph.ClassInfo;
import lombok.extern.java.Log;
import ru.xodavit.deadsimple.framework.annotation.RequestMapping;
import ru.xodavit.deadsimple.framework.exception.HandlerRegistrationException;
import ru.xodavit.deadsimple.framework.exception.MalformedRequestException;
import ru.xodavit.deadsimple.framework.exception.ServerException;
import ru.xodavit.deadsimple.framework.resolver.argument.HandlerMethodArgumentResolver;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.lang.reflect.Method;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.stream.Collectors;

/**
 * Embeddable HTTP server: a route table, one shared state value and an accept loop.
 * <pre>{@code
 * new WebServer<>("127.0.0.1:8000", new ArrayList<String>())
 *         .register("/", HttpMethod.GET, request -> Response.html("<h1>hi</h1>"))
 *         .register("404", HttpMethod.GET, request -> Response.text("nothing here"))
 *         .listen(false);
 * }</pre>
 * Every accepted connection is parsed, dispatched and answered on its own thread; the accept loop never
 * waits for a handler and there is no cap on connections in flight. Each connection carries exactly one
 * request and is closed after the response. A stopped server can't be bound or listened on again.
 *
 * @param <T> type of the shared state
 */
@Log
public class WebServer<T> {
    private static final String URL_SCHEME = "http://";

    private final InetSocketAddress address;
    private final RouteTable<T> routes = new RouteTable<>();
    private final SharedState<T> sharedState;
    private final RequestParser parser = new RequestParser();
    private final ResponseEncoder encoder = new ResponseEncoder();
    private final Dispatcher<T> dispatcher;
    private final List<HandlerMethodArgumentResolver> argumentResolvers = new CopyOnWriteArrayList<>();
    private final ExecutorService executorService = Executors.newCachedThreadPool(r -> {
        final var thread = new Thread(r);
        thread.setDaemon(true);
        return thread;
    });
    // state -> NOT_STARTED, STARTED, STOPPED
    private volatile boolean isStopped = false;
    private volatile ServerSocket serverSocket;

    /**
     * @param address {@code host:port}, port 0 picks an ephemeral port
     */
    public WebServer(String address, T initialState) {
        this(parseAddress(address), initialState);
    }

    public WebServer(InetSocketAddress address, T initialState) {
        this.address = address;
        this.sharedState = new SharedState<>(initialState);
        this.dispatcher = new Dispatcher<>(routes, sharedState, encoder);
    }

    public WebServer<T> register(String pattern, HttpMethod method, Handler<T> handler) {
        routes.register(method, pattern, handler);
        log.fine(() -> "registered " + method + " " + pattern);
        return this;
    }

    /**
     * Registers every public {@link RequestMapping} method found in {@code pkg}. Classes are taken in name
     * order and methods in name order within a class, which fixes their match priority.
     */
    public WebServer<T> autoRegisterHandlers(String pkg) {
        try (final var scanResult = new ClassGraph().enableAllInfo().acceptPackages(pkg).scan()) {
            final List<ClassInfo> classes = new ArrayList<>(scanResult.getClassesWithMethodAnnotation(RequestMapping.class.getName()));
            classes.sort(Comparator.comparing(ClassInfo::getName));

            for (final var classInfo : classes) {
                final var handler = classInfo.loadClass().getConstructor().newInstance();
                final List<Method> methods = Arrays.stream(handler.getClass().getMethods())
                        .filter(method -> method.isAnnotationPresent(RequestMapping.class))
                        .sorted(Comparator.comparing(Method::getName))
                        .collect(Collectors.toList());

                for (final var method : methods) {
                    final RequestMapping mapping = method.getAnnotation(RequestMapping.class);
                    register(mapping.path(), mapping.method(), new HandlerMethod<>(handler, method, argumentResolvers));
                }
            }
        } catch (ReflectiveOperationException e) {
            throw new HandlerRegistrationException("can't instantiate handlers of " + pkg, e);
        }
        return this;
    }

    public WebServer<T> addArgumentResolver(HandlerMethodArgumentResolver... resolvers) {
        argumentResolvers.addAll(List.of(resolvers));
        return this;
    }

    public SharedState<T> getSharedState() {
        return sharedState;
    }

    /**
     * Binds the listening socket unless already bound.
     *
     * @return the bound port
     */
    public synchronized int bind() {
        if (isStopped) {
            throw new IllegalStateException("server is stopped");
        }
        if (serverSocket == null) {
            try {
                final var socket = new ServerSocket();
                socket.bind(address);
                serverSocket = socket;
            } catch (IOException e) {
                throw new ServerException("can't bind " + address, e);
            }
        }
        return serverSocket.getLocalPort();
    }

    /**
     * Binds if needed and runs the accept loop until {@link #stop()}.
     *
     * @param openInBrowser try to open the server's URL in a local browser; failure is ignored
     * @throws IllegalStateException if the server was stopped
     */
    public void listen(boolean openInBrowser) {
        final var port = bind();
        final var url = URL_SCHEME + address.getHostString() + ":" + port;
        if (openInBrowser) {
            openInBrowser(url);
        }
        log.log(Level.INFO, "Listening on " + url);

        try {
            while (!isStopped && !Thread.currentThread().isInterrupted()) {
                if (!submit(serverSocket.accept())) {
                    break;
                }
            }
        } catch (IOException e) {
            if (!isStopped) {
                throw new ServerException(e);
            }
        }
    }

    public synchronized void stop() {
        log.info("command to stop the server received");
        this.isStopped = true;
        executorService.shutdown();
        try {
            if (serverSocket != null) {
                serverSocket.close();
            }
        } catch (IOException e) {
            log.severe(e.getMessage());
            throw new ServerException(e);
        }
        log.info("Server has been stopped");
    }

    /**
     * @return false if the executor is shut down; the socket is then closed unanswered
     */
    boolean submit(final Socket socket) {
        try {
            executorService.submit(() -> handle(socket));
            return true;
        } catch (RejectedExecutionException e) {
            log.fine(() -> "server stopped, dropping connection " + socket.getPort());
            try {
                socket.close();
            } catch (IOException closeFailure) {
                log.log(Level.FINE, "can't close rejected connection", closeFailure);
            }
            return false;
        }
    }

    void handle(final Socket socket) {
        try (
                socket;
                final var in = socket.getInputStream();
                final var out = new BufferedOutputStream(socket.getOutputStream())
        ) {
            log.fine(() -> "connected: " + socket.getPort());

            final ParsedRequest request;
            try {
                request = parser.parse(in);
            } catch (MalformedRequestException e) {
                log.fine(() -> "malformed request from " + socket.getPort() + ": " + e.getMessage());
                encoder.writeInternalServerError(out);
                return;
            }

            dispatcher.dispatch(request, socket, out);
        } catch (IOException e) {
            log.log(Level.WARNING, "connection " + socket.getPort() + " dropped", e);
        }
    }

    private static void openInBrowser(String url) {
        try {
            if (!GraphicsEnvironment.isHeadless()
                    && Desktop.isDesktopSupported()
                    && Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
                Desktop.getDesktop().browse(URI.create(url));
            }
        } catch (IOException | UnsupportedOperationException | SecurityException e) {
            log.fine(() -> "can't open " + url + " in a browser: " + e.getMessage());
        }
    }

    private static InetSocketAddress parseAddress(String address) {
        final var separator = address.lastIndexOf(':');
        if (separator == -1) {
            throw new IllegalArgumentException("address must be host:port, got " + address);
        }
        try {
            return new InetSocketAddress(address.substring(0, separator), Integer.parseInt(address.substring(separator + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port in " + address, e);
        }
    }
}
