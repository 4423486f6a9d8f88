package ru.xodavit.deadsimple.framework;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ParsedRequest {
  HttpMethod method;
  // without the query suffix
  String path;
  String rawPath;
  Map<String, String> query;
  Map<String, String> headers;
  @Builder.Default
  byte[] body = new byte[]{};
}
