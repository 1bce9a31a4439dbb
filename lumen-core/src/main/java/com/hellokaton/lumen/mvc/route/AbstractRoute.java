package com.hellokaton.lumen.mvc.route;

import com.hellokaton.lumen.kit.PathKit;
import com.hellokaton.lumen.mvc.handler.ExceptionHandler;
import com.hellokaton.lumen.mvc.handler.ExceptionKey;
import com.hellokaton.lumen.mvc.handler.Interceptor;
import com.hellokaton.lumen.mvc.handler.Permission;
import com.hellokaton.lumen.mvc.hook.Middleware;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarations shared by includes and gateways.
 */
abstract class AbstractRoute<R extends AbstractRoute<R>> implements RouteNode {

    private final String path;
    private String name;
    private final List<Middleware> middleware = new ArrayList<>();
    private final Map<ExceptionKey, ExceptionHandler> exceptionHandlers = new LinkedHashMap<>();
    private final List<Permission> permissions = new ArrayList<>();
    private final List<Interceptor> interceptors = new ArrayList<>();

    AbstractRoute(String path) {
        this.path = PathKit.fixPath(path);
    }

    protected abstract R self();

    public R name(String name) {
        this.name = name;
        return self();
    }

    public R middleware(Middleware... middleware) {
        Collections.addAll(this.middleware, middleware);
        return self();
    }

    public R exceptionHandler(Class<? extends Throwable> type, ExceptionHandler handler) {
        this.exceptionHandlers.put(ExceptionKey.of(type), handler);
        return self();
    }

    public R exceptionHandler(int status, ExceptionHandler handler) {
        this.exceptionHandlers.put(ExceptionKey.of(status), handler);
        return self();
    }

    public R permissions(Permission... permissions) {
        Collections.addAll(this.permissions, permissions);
        return self();
    }

    public R interceptors(Interceptor... interceptors) {
        Collections.addAll(this.interceptors, interceptors);
        return self();
    }

    @Override
    public String getPath() {
        return path;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<Middleware> getMiddleware() {
        return Collections.unmodifiableList(middleware);
    }

    @Override
    public Map<ExceptionKey, ExceptionHandler> getExceptionHandlers() {
        return Collections.unmodifiableMap(exceptionHandlers);
    }

    @Override
    public List<Permission> getPermissions() {
        return Collections.unmodifiableList(permissions);
    }

    @Override
    public List<Interceptor> getInterceptors() {
        return Collections.unmodifiableList(interceptors);
    }

}
