package ru.xodavit.deadsimple.framework.annotation;

import ru.xodavit.deadsimple.framework.HttpMethod;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a public method returning {@code Response} as the handler of {@code method path}.
 * Picked up by {@code WebServer.autoRegisterHandlers}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequestMapping {
  HttpMethod method() default HttpMethod.GET;

  String path();
}
