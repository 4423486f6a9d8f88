package ru.xodavit.deadsimple.framework;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error kinds a handler can answer with. The status code is informational only, every error is
 * written to the wire as the same generic 500 response.
 */
@Getter
@RequiredArgsConstructor
public enum WebError {
  BAD_REQUEST(400),
  NOT_FOUND(404),
  INTERNAL_SERVER_ERROR(500);

  private final int statusCode;
}
