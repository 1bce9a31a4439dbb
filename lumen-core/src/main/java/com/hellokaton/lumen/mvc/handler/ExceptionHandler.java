package com.hellokaton.lumen.mvc.handler;

import com.hellokaton.lumen.mvc.RouteContext;

/**
 * Turns an error raised while handling a request into a response.
 */
@FunctionalInterface
public interface ExceptionHandler {

    void handle(RouteContext context, Throwable cause) throws Exception;

}
