package ru.xodavit.deadsimple.framework;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;

import java.util.Objects;

/**
 * Typed result of a handler: one of the {@link ResponseType} variants and its payload. Textual
 * variants carry a string, image variants raw bytes, {@code JSON} a Jackson tree and {@code ERROR}
 * only its {@link WebError}.
 */
@Getter
public final class Response {
    static final ObjectMapper MAPPER = new ObjectMapper();

    private final ResponseType type;
    private final String text;
    private final byte[] bytes;
    private final JsonNode json;
    private final WebError error;

    private Response(ResponseType type, String text, byte[] bytes, JsonNode json, WebError error) {
        this.type = type;
        this.text = text;
        this.bytes = bytes;
        this.json = json;
        this.error = error;
    }

    public static Response html(String html) {
        return text(ResponseType.HTML, html);
    }

    public static Response xml(String xml) {
        return text(ResponseType.XML, xml);
    }

    public static Response svg(String svg) {
        return text(ResponseType.SVG, svg);
    }

    public static Response js(String js) {
        return text(ResponseType.JS, js);
    }

    public static Response text(String text) {
        return text(ResponseType.TEXT, text);
    }

    public static Response css(String css) {
        return text(ResponseType.CSS, css);
    }

    /**
     * @param value a {@link JsonNode} or anything Jackson can convert into one
     */
    public static Response json(Object value) {
        final var node = value instanceof JsonNode ? (JsonNode) value : MAPPER.valueToTree(value);
        return new Response(ResponseType.JSON, null, null, node, null);
    }

    public static Response png(byte[] bytes) {
        return binary(ResponseType.PNG, bytes);
    }

    public static Response jpg(byte[] bytes) {
        return binary(ResponseType.JPG, bytes);
    }

    public static Response gif(byte[] bytes) {
        return binary(ResponseType.GIF, bytes);
    }

    public static Response webp(byte[] bytes) {
        return binary(ResponseType.WEBP, bytes);
    }

    public static Response error(WebError error) {
        return new Response(ResponseType.ERROR, null, null, null, Objects.requireNonNull(error, "error"));
    }

    private static Response text(ResponseType type, String text) {
        return new Response(type, Objects.requireNonNull(text, "text"), null, null, null);
    }

    // copied, later changes to the caller's array don't reach the wire
    private static Response binary(ResponseType type, byte[] bytes) {
        return new Response(type, null, Objects.requireNonNull(bytes, "bytes").clone(), null, null);
    }

    /**
     * @return a copy of the image payload, {@code null} for other variants
     */
    public byte[] getBytes() {
        return bytes == null ? null : bytes.clone();
    }

    @Override
    public String toString() {
        return type == ResponseType.ERROR ? "Response(ERROR " + error + ")" : "Response(" + type + ")";
    }
}
