package ru.xodavit.deadsimple.app;

import ru.xodavit.deadsimple.framework.HttpMethod;
import ru.xodavit.deadsimple.framework.RequestContext;
import ru.xodavit.deadsimple.framework.Response;
import ru.xodavit.deadsimple.framework.WebServer;

import java.util.Base64;
import java.util.Map;

public class Main {
    // 1x1 transparent GIF
    private static final byte[] PIXEL = Base64.getDecoder().decode("R0lGODlhAQABAIAAAAAAAP///yH5BAEAAAAALAAAAAABAAEAAAIBRAA7");

    public static void main(String[] args) {
        create("127.0.0.1:8000").listen(true);
    }

    public static WebServer<Object> create(String address) {
        return new WebServer<>(address, new Object())
                .register("/", HttpMethod.GET, Main::root)
                .register("/{value}/give", HttpMethod.GET, Main::give)
                .register("/hello", HttpMethod.GET, request -> Response.html("<h1>Hello!</h1>"))
                .register("/test", HttpMethod.GET, request -> Response.gif(PIXEL))
                .register("404", HttpMethod.GET, request -> Response.html("404 :("));
    }

    static Response root(RequestContext<Object> request) {
        return Response.html("<h1>Hello, World! " + request.getArgs() + "</h1>");
    }

    static Response give(RequestContext<Object> request) {
        return Response.json(Map.of("YourValue", request.getParam("value")));
    }
}
