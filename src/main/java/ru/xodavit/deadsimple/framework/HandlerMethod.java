package ru.xodavit.deadsimple.framework;

import lombok.Getter;
import ru.xodavit.deadsimple.framework.exception.HandlerRegistrationException;
import ru.xodavit.deadsimple.framework.exception.RequestHandleException;
import ru.xodavit.deadsimple.framework.exception.UnsupportedParameterException;
import ru.xodavit.deadsimple.framework.resolver.argument.HandlerMethodArgumentResolver;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;

/**
 * A {@link Handler} backed by an annotated method of a handler object. Each parameter is filled by
 * the first argument resolver that supports it.
 */
@Getter
public class HandlerMethod<T> implements Handler<T> {
    private final Object handler;
    private final Method method;
    private final List<HandlerMethodArgumentResolver> argumentResolvers;

    public HandlerMethod(Object handler, Method method, List<HandlerMethodArgumentResolver> argumentResolvers) {
        if (!Response.class.isAssignableFrom(method.getReturnType())) {
            throw new HandlerRegistrationException(method + " must return " + Response.class.getSimpleName());
        }
        this.handler = handler;
        this.method = method;
        this.argumentResolvers = argumentResolvers;
    }

    @Override
    public Response handle(RequestContext<T> request) {
        final var arguments = new ArrayList<>(method.getParameterCount());
        for (final var parameter : method.getParameters()) {
            var resolved = false;
            for (final var argumentResolver : argumentResolvers) {
                if (!argumentResolver.supportsParameter(parameter)) {
                    continue;
                }

                arguments.add(argumentResolver.resolveArgument(parameter, request));
                resolved = true;
                break;
            }
            if (!resolved) {
                throw new UnsupportedParameterException(parameter.getType().getName());
            }
        }

        try {
            return (Response) method.invoke(handler, arguments.toArray());
        } catch (InvocationTargetException e) {
            final var cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new RequestHandleException(method + " failed", cause);
        } catch (IllegalAccessException e) {
            throw new RequestHandleException(method + " is not accessible", e);
        }
    }
}
