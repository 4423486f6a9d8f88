package ru.xodavit.deadsimple.app.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.java.Log;
import ru.xodavit.deadsimple.app.dto.ChatMessage;
import ru.xodavit.deadsimple.framework.HttpMethod;
import ru.xodavit.deadsimple.framework.Response;
import ru.xodavit.deadsimple.framework.SharedState;
import ru.xodavit.deadsimple.framework.WebError;
import ru.xodavit.deadsimple.framework.annotation.RequestMapping;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Log
public class ChatHandlers {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @RequestMapping(method = HttpMethod.GET, path = "/")
    public Response page() {
        try (final var in = ChatHandlers.class.getResourceAsStream("/chat.html")) {
            if (in == null) {
                return Response.error(WebError.NOT_FOUND);
            }
            return Response.html(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @RequestMapping(method = HttpMethod.POST, path = "/chat")
    public Response chat(SharedState<List<ChatMessage>> messages, byte[] body) {
        final var fields = parseFields(body);
        final var username = fields.get("username");
        final var message = fields.get("message");
        if (username == null || message == null) {
            return Response.error(WebError.BAD_REQUEST);
        }

        messages.update(history -> history.add(new ChatMessage(username, message)));
        return history(messages);
    }

    @RequestMapping(method = HttpMethod.GET, path = "/history")
    public Response history(SharedState<List<ChatMessage>> messages) {
        return messages.withLock(history -> Response.json(Map.of("messages", new ArrayList<>(history))));
    }

    // a flat object of strings only; any other value rejects the whole body
    private static Map<String, String> parseFields(byte[] body) {
        try {
            final var tree = MAPPER.readTree(body);
            if (tree == null || !tree.isObject()) {
                return Collections.emptyMap();
            }

            final var fields = new HashMap<String, String>();
            final var entries = tree.fields();
            while (entries.hasNext()) {
                final var entry = entries.next();
                if (!entry.getValue().isTextual()) {
                    return Collections.emptyMap();
                }
                fields.put(entry.getKey(), entry.getValue().textValue());
            }
            return fields;
        } catch (IOException e) {
            log.fine(() -> "not a chat message: " + e.getMessage());
            return Collections.emptyMap();
        }
    }
}
