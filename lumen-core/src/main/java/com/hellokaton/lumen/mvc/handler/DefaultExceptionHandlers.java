package com.hellokaton.lumen.mvc.handler;

import com.hellokaton.lumen.exception.HttpException;
import com.hellokaton.lumen.exception.ImproperlyConfiguredException;
import com.hellokaton.lumen.exception.ValidationErrorException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception handlers every application starts with unless it registers its own.
 */
public final class DefaultExceptionHandlers {

    private DefaultExceptionHandlers() {
    }

    public static final ExceptionHandler IMPROPERLY_CONFIGURED = (context, cause) -> {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("detail", cause.getMessage());
        body.put("status_code", 500);
        context.status(500).json(body);
    };

    public static final ExceptionHandler VALIDATION_ERROR = (context, cause) -> {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("detail", cause instanceof HttpException ? ((HttpException) cause).getDetail() : cause.getMessage());
        if (cause instanceof ValidationErrorException) {
            body.put("errors", ((ValidationErrorException) cause).getErrors());
        }
        body.put("status_code", 400);
        context.status(400).json(body);
    };

    /**
     * Renders an {@link HttpException} that has no registered handler.
     */
    public static final ExceptionHandler HTTP_EXCEPTION = (context, cause) -> {
        HttpException e = (HttpException) cause;
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("detail", e.getDetail());
        body.put("status_code", e.getStatus());
        context.status(e.getStatus()).json(body);
    };

    public static Map<ExceptionKey, ExceptionHandler> defaults() {
        Map<ExceptionKey, ExceptionHandler> defaults = new LinkedHashMap<>();
        defaults.put(ExceptionKey.of(ImproperlyConfiguredException.class), IMPROPERLY_CONFIGURED);
        defaults.put(ExceptionKey.of(ValidationErrorException.class), VALIDATION_ERROR);
        return Collections.unmodifiableMap(defaults);
    }

}
