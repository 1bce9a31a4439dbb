package com.hellokaton.lumen.mvc.handler;

import com.hellokaton.lumen.mvc.RouteContext;

/**
 * Route logic bound to a gateway.
 */
@FunctionalInterface
public interface RouteHandler {

    void handle(RouteContext context) throws Exception;

}
