package ru.xodavit.deadsimple.framework.resolver.argument;


import ru.xodavit.deadsimple.framework.RequestContext;

import java.lang.reflect.Parameter;

public interface HandlerMethodArgumentResolver {
  boolean supportsParameter(Parameter parameter);
  Object resolveArgument(Parameter parameter, RequestContext<?> request);
}
