package ru.xodavit.deadsimple.framework;

import lombok.Builder;
import lombok.Value;

import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * What a handler sees of one dispatched request. The socket belongs to the in-flight dispatch and is
 * closed by the server once the handler's response has been written. {@link #getBody()} is the dispatch's own
 * array, not a copy; nothing else reads it.
 */
@Value
@Builder
public class RequestContext<T> {
  SharedState<T> sharedState;
  Map<String, String> params;
  Map<String, String> args;
  @Builder.Default
  byte[] body = new byte[]{};
  Socket connection;

  public String getParam(String name) {
    return params.get(name);
  }

  public String getArg(String name) {
    return args.get(name);
  }

  public String getBodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }
}
