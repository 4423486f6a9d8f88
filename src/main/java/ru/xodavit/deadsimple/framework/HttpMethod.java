package ru.xodavit.deadsimple.framework;

public enum HttpMethod {
  GET,
  POST,
  PUT,
  PATCH,
  DELETE,
  HEAD,
  OPTIONS,
  TRACE;

  /**
   * Case-sensitive lookup of a request-line method token.
   * Unknown tokens resolve to {@link #GET} instead of failing.
   */
  public static HttpMethod parse(String token) {
    for (final var method : values()) {
      if (method.name().equals(token)) {
        return method;
      }
    }
    return GET;
  }
}
