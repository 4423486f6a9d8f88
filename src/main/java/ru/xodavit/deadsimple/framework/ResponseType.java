package ru.xodavit.deadsimple.framework;

import lombok.RequiredArgsConstructor;

import java.util.Optional;

@RequiredArgsConstructor
public enum ResponseType {
  HTML("text/html", false),
  XML("text/xml", false),
  SVG("image/svg+xml", false),
  JS("application/javascript", false),
  JSON("application/json", false),
  TEXT("text/plain", false),
  CSS("text/css", false),
  PNG("image/png", true),
  JPG("image/jpeg", true),
  GIF("image/gif", true),
  WEBP("image/webp", true),
  ERROR(null, false);

  private final String contentType;
  private final boolean binary;

  /**
   * @return the Content-Type header value, empty for {@link #ERROR}
   */
  public Optional<String> contentType() {
    return Optional.ofNullable(contentType);
  }

  public boolean isBinary() {
    return binary;
  }
}
