package ru.xodavit.deadsimple.framework.resolver.argument;

import ru.xodavit.deadsimple.framework.RequestContext;
import ru.xodavit.deadsimple.framework.exception.UnsupportedParameterException;

import java.lang.reflect.Parameter;

public class RequestContextHandlerMethodArgumentResolver implements HandlerMethodArgumentResolver {
  @Override
  public boolean supportsParameter(Parameter parameter) {
    return parameter.getType().equals(RequestContext.class);
  }

  @Override
  public Object resolveArgument(Parameter parameter, RequestContext<?> request) {
    if (!supportsParameter(parameter)) {
      // this should never happen
      throw new UnsupportedParameterException(parameter.getType().getName());
    }

    return request;
  }
}
