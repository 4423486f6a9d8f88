package ru.xodavit.deadsimple.app.chat;

import ru.xodavit.deadsimple.app.dto.ChatMessage;
import ru.xodavit.deadsimple.framework.WebServer;
import ru.xodavit.deadsimple.framework.resolver.argument.RequestBodyHandlerMethodArgumentResolver;
import ru.xodavit.deadsimple.framework.resolver.argument.SharedStateHandlerMethodArgumentResolver;

import java.util.ArrayList;
import java.util.List;

public class ChatApp {
    public static void main(String[] args) {
        create("127.0.0.1:8000").listen(false);
    }

    public static WebServer<List<ChatMessage>> create(String address) {
        return new WebServer<List<ChatMessage>>(address, new ArrayList<>())
                .addArgumentResolver(
                        new SharedStateHandlerMethodArgumentResolver(),
                        new RequestBodyHandlerMethodArgumentResolver()
                )
                .autoRegisterHandlers(ChatApp.class.getPackageName());
    }
}
