package ru.xodavit.deadsimple.framework;

@FunctionalInterface
public interface Handler<T> {
  Response handle(final RequestContext<T> request);
}
