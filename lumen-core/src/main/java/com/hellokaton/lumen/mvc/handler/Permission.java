package com.hellokaton.lumen.mvc.handler;

import com.hellokaton.lumen.mvc.RouteContext;

/**
 * Access check evaluated before a route handler runs. Every permission
 * collected along the route path must grant access.
 */
@FunctionalInterface
public interface Permission {

    boolean hasPermission(RouteContext context);

}
