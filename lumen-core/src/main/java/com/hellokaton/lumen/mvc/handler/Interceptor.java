package com.hellokaton.lumen.mvc.handler;

import com.hellokaton.lumen.mvc.RouteContext;

/**
 * Runs before a route handler, outermost declaration first.
 */
@FunctionalInterface
public interface Interceptor {

    void intercept(RouteContext context) throws Exception;

}
