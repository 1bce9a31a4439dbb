package com.hellokaton.lumen.mvc.handler;

import com.hellokaton.lumen.exception.HttpException;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolved exception handlers: a typed map plus the single catch-all
 * error handler partitioned out of it.
 */
@Getter
public class ExceptionHandlerMap {

    public static final ExceptionHandlerMap EMPTY = new ExceptionHandlerMap(Collections.<ExceptionKey, ExceptionHandler>emptyMap(), null);

    private final Map<ExceptionKey, ExceptionHandler> handlers;
    private final ExceptionHandler errorHandler;

    private ExceptionHandlerMap(Map<ExceptionKey, ExceptionHandler> handlers, ExceptionHandler errorHandler) {
        this.handlers = handlers;
        this.errorHandler = errorHandler;
    }

    /**
     * Split merged registrations into typed handlers and the error handler.
     * When several catch-all keys are registered the last one wins.
     */
    public static ExceptionHandlerMap partition(Map<ExceptionKey, ExceptionHandler> merged) {
        Map<ExceptionKey, ExceptionHandler> typed = new LinkedHashMap<>();
        ExceptionHandler errorHandler = null;
        for (Map.Entry<ExceptionKey, ExceptionHandler> entry : merged.entrySet()) {
            if (entry.getKey().isCatchAll()) {
                errorHandler = entry.getValue();
            } else {
                typed.put(entry.getKey(), entry.getValue());
            }
        }
        return new ExceptionHandlerMap(Collections.unmodifiableMap(typed), errorHandler);
    }

    /**
     * Most specific typed handler for the error: the status code of an
     * {@link HttpException} first, then the class hierarchy from the
     * concrete type upwards.
     *
     * @return the handler, or {@code null}
     */
    public ExceptionHandler lookup(Throwable cause) {
        if (handlers.isEmpty()) {
            return null;
        }
        if (cause instanceof HttpException) {
            ExceptionHandler handler = handlers.get(ExceptionKey.of(((HttpException) cause).getStatus()));
            if (null != handler) {
                return handler;
            }
        }
        Class<?> type = cause.getClass();
        while (null != type && Throwable.class.isAssignableFrom(type)) {
            ExceptionHandler handler = handlers.get(ExceptionKey.of(type.asSubclass(Throwable.class)));
            if (null != handler) {
                return handler;
            }
            type = type.getSuperclass();
        }
        return null;
    }

    /**
     * Typed handler if any, else the error handler.
     *
     * @return the handler, or {@code null} when the error is unhandled
     */
    public ExceptionHandler resolve(Throwable cause) {
        ExceptionHandler handler = lookup(cause);
        return null != handler ? handler : errorHandler;
    }

    public boolean hasErrorHandler() {
        return null != errorHandler;
    }

    public boolean isEmpty() {
        return handlers.isEmpty() && null == errorHandler;
    }

}
