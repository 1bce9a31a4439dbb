package com.hellokaton.lumen.mvc.route;

import com.hellokaton.lumen.mvc.handler.ExceptionHandlerMap;
import com.hellokaton.lumen.mvc.handler.Interceptor;
import com.hellokaton.lumen.mvc.handler.Permission;

import java.util.Collections;
import java.util.List;

/**
 * Internal structure associating a dispatch target with its full path, the
 * includes enclosing it and the declarations merged along that path.
 */
public class ResolvedRoute {

    private final String path;
    private final RouteNode target;
    private final List<Include> ancestors;
    private ExceptionHandlerMap exceptionHandlers = ExceptionHandlerMap.EMPTY;
    private List<Permission> permissions = Collections.emptyList();
    private List<Interceptor> interceptors = Collections.emptyList();

    public ResolvedRoute(String path, RouteNode target, List<Include> ancestors) {
        this.path = path;
        this.target = target;
        this.ancestors = ancestors;
    }

    public String getPath() {
        return path;
    }

    public RouteNode getTarget() {
        return target;
    }

    public List<Include> getAncestors() {
        return ancestors;
    }

    public boolean isMount() {
        return target instanceof Include;
    }

    public ExceptionHandlerMap getExceptionHandlers() {
        return exceptionHandlers;
    }

    public void setExceptionHandlers(ExceptionHandlerMap exceptionHandlers) {
        this.exceptionHandlers = exceptionHandlers;
    }

    public List<Permission> getPermissions() {
        return permissions;
    }

    public void setPermissions(List<Permission> permissions) {
        this.permissions = permissions;
    }

    public List<Interceptor> getInterceptors() {
        return interceptors;
    }

    public void setInterceptors(List<Interceptor> interceptors) {
        this.interceptors = interceptors;
    }

}
