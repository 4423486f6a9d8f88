package ru.xodavit.deadsimple.framework;

import lombok.Value;

@Value
public class Route<T> {
  String pattern;
  Handler<T> handler;
}
