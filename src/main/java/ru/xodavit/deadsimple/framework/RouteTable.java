package ru.xodavit.deadsimple.framework;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-method ordered buckets of {@link Route}s.
 * <p>
 * Patterns are {@code /}-delimited; a segment written {@code {name}} is a wildcard that matches any
 * single path segment. Patterns are not validated, a malformed one simply never matches.
 * Within a bucket the first structurally compatible pattern wins, so registration order is
 * match priority.
 */
public class RouteTable<T> {
  private static final String SEGMENT_DELIMITER = "/";

  // GET -> [("/", handler), ("/user/{id}", handler)]
  private final Map<HttpMethod, List<Route<T>>> buckets = new EnumMap<>(HttpMethod.class);

  public RouteTable() {
    for (final var method : HttpMethod.values()) {
      buckets.put(method, new CopyOnWriteArrayList<>());
    }
  }

  public void register(HttpMethod method, String pattern, Handler<T> handler) {
    buckets.get(method).add(new Route<>(pattern, handler));
  }

  public Optional<RouteMatch<T>> find(HttpMethod method, String path) {
    final var pathOnly = stripQuery(path);
    for (final var route : buckets.get(method)) {
      if (compare(pathOnly, route.getPattern())) {
        return Optional.of(new RouteMatch<>(route, extract(pathOnly, route.getPattern())));
      }
    }
    return Optional.empty();
  }

  public List<Route<T>> routes(HttpMethod method) {
    return Collections.unmodifiableList(new ArrayList<>(buckets.get(method)));
  }

  static boolean compare(String path, String pattern) {
    final var pathSegments = split(path);
    final var patternSegments = split(pattern);
    if (pathSegments.length != patternSegments.length) {
      return false;
    }

    for (int i = 0; i < patternSegments.length; i++) {
      if (!isWildcard(patternSegments[i]) && !patternSegments[i].equals(pathSegments[i])) {
        return false;
      }
    }
    return true;
  }

  static Map<String, String> extract(String path, String pattern) {
    final var pathSegments = split(path);
    final var patternSegments = split(pattern);
    final var params = new HashMap<String, String>();

    final var common = Math.min(pathSegments.length, patternSegments.length);
    for (int i = 0; i < common; i++) {
      final var segment = patternSegments[i];
      if (isWildcard(segment)) {
        params.put(segment.substring(1, segment.length() - 1), pathSegments[i]);
      }
    }
    return params;
  }

  private static boolean isWildcard(String segment) {
    return segment.length() >= 2 && segment.startsWith("{") && segment.endsWith("}");
  }

  private static String stripQuery(String path) {
    final var queryStart = path.indexOf('?');
    return queryStart < 0 ? path : path.substring(0, queryStart);
  }

  // keeps trailing empty segments: "/a/" is three segments, "/a" two
  private static String[] split(String value) {
    return value.split(SEGMENT_DELIMITER, -1);
  }
}
