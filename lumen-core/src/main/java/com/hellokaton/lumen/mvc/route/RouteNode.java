package com.hellokaton.lumen.mvc.route;

import com.hellokaton.lumen.mvc.handler.ExceptionHandler;
import com.hellokaton.lumen.mvc.handler.ExceptionKey;
import com.hellokaton.lumen.mvc.handler.Interceptor;
import com.hellokaton.lumen.mvc.handler.Permission;
import com.hellokaton.lumen.mvc.hook.Middleware;

import java.util.List;
import java.util.Map;

/**
 * A node of the route tree: an {@link Include} grouping child routes, or a
 * {@link Gateway} binding a path to a handler.
 */
public interface RouteNode {

    String getPath();

    String getName();

    List<Middleware> getMiddleware();

    Map<ExceptionKey, ExceptionHandler> getExceptionHandlers();

    List<Permission> getPermissions();

    List<Interceptor> getInterceptors();

}
