package ru.xodavit.deadsimple.framework.resolver.argument;

import ru.xodavit.deadsimple.framework.annotation.QueryParam;
import ru.xodavit.deadsimple.framework.RequestContext;
import ru.xodavit.deadsimple.framework.exception.UnsupportedParameterException;

import java.lang.reflect.Parameter;

public class QueryParamHandlerMethodArgumentResolver implements HandlerMethodArgumentResolver {
  @Override
  public boolean supportsParameter(Parameter parameter) {
    return parameter.isAnnotationPresent(QueryParam.class) && parameter.getType().equals(String.class);
  }

  @Override
  public Object resolveArgument(Parameter parameter, RequestContext<?> request) {
    if (!supportsParameter(parameter)) {
      // this should never happen
      throw new UnsupportedParameterException(parameter.getType().getName());
    }

    return request.getArg(parameter.getAnnotation(QueryParam.class).value());
  }
}
