package com.hellokaton.lumen.mvc.handler;

import com.hellokaton.lumen.mvc.hook.Middleware;
import com.hellokaton.lumen.mvc.http.HttpMethod;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A {@link RouteHandler} together with the http methods it answers and
 * its own middleware, exception handlers, permissions and interceptors.
 * <p>
 * Handler level declarations are collected after those of the gateway the
 * handler is bound to.
 */
@Getter
public class HttpHandler {

    private final RouteHandler handler;
    private final Set<HttpMethod> methods;
    private final List<Middleware> middleware = new ArrayList<>();
    private final Map<ExceptionKey, ExceptionHandler> exceptionHandlers = new LinkedHashMap<>();
    private final List<Permission> permissions = new ArrayList<>();
    private final List<Interceptor> interceptors = new ArrayList<>();

    public HttpHandler(RouteHandler handler, HttpMethod... methods) {
        if (null == handler) {
            throw new IllegalArgumentException("Route handler must not be null");
        }
        this.handler = handler;
        this.methods = methods.length == 0 ? EnumSet.of(HttpMethod.GET) : EnumSet.of(methods[0], methods);
        if (this.methods.contains(HttpMethod.GET)) {
            this.methods.add(HttpMethod.HEAD);
        }
    }

    public static HttpHandler get(RouteHandler handler) {
        return new HttpHandler(handler, HttpMethod.GET);
    }

    public static HttpHandler post(RouteHandler handler) {
        return new HttpHandler(handler, HttpMethod.POST);
    }

    public static HttpHandler put(RouteHandler handler) {
        return new HttpHandler(handler, HttpMethod.PUT);
    }

    public static HttpHandler delete(RouteHandler handler) {
        return new HttpHandler(handler, HttpMethod.DELETE);
    }

    public static HttpHandler route(RouteHandler handler, HttpMethod... methods) {
        return new HttpHandler(handler, methods);
    }

    public HttpHandler middleware(Middleware... middleware) {
        Collections.addAll(this.middleware, middleware);
        return this;
    }

    public HttpHandler exceptionHandler(Class<? extends Throwable> type, ExceptionHandler handler) {
        this.exceptionHandlers.put(ExceptionKey.of(type), handler);
        return this;
    }

    public HttpHandler exceptionHandler(int status, ExceptionHandler handler) {
        this.exceptionHandlers.put(ExceptionKey.of(status), handler);
        return this;
    }

    public HttpHandler permissions(Permission... permissions) {
        Collections.addAll(this.permissions, permissions);
        return this;
    }

    public HttpHandler interceptors(Interceptor... interceptors) {
        Collections.addAll(this.interceptors, interceptors);
        return this;
    }

    public boolean allows(HttpMethod method) {
        return methods.contains(method);
    }

}
