package ru.xodavit.deadsimple.framework;

import lombok.Value;

import java.util.Map;

@Value
public class RouteMatch<T> {
  Route<T> route;
  Map<String, String> params;

  public Handler<T> getHandler() {
    return route.getHandler();
  }
}
