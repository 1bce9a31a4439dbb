package com.hellokaton.lumen.mvc.route;

import com.hellokaton.lumen.Lumen;
import com.hellokaton.lumen.config.AppConfig;
import com.hellokaton.lumen.exception.HttpException;
import com.hellokaton.lumen.exception.ImproperlyConfiguredException;
import com.hellokaton.lumen.exception.NotFoundException;
import com.hellokaton.lumen.exception.PermissionDeniedException;
import com.hellokaton.lumen.kit.PathKit;
import com.hellokaton.lumen.mvc.Application;
import com.hellokaton.lumen.mvc.RouteContext;
import com.hellokaton.lumen.mvc.handler.ExceptionHandler;
import com.hellokaton.lumen.mvc.handler.ExceptionHandlerRegistry;
import com.hellokaton.lumen.mvc.handler.HttpHandler;
import com.hellokaton.lumen.mvc.handler.Interceptor;
import com.hellokaton.lumen.mvc.handler.Permission;
import com.hellokaton.lumen.mvc.hook.Middleware;
import com.hellokaton.lumen.mvc.http.Cookie;
import com.hellokaton.lumen.mvc.http.HttpMethod;
import com.hellokaton.lumen.mvc.http.Response;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Innermost layer of the middleware chain: matches the request path against
 * the route tree and runs the bound handler.
 * <p>
 * Gateways match on the exact path. Includes mounting an application match
 * on their prefix, longest first, and receive the remaining path. Routes
 * take effect after {@link #register()}, which the owning application calls
 * on every rebuild.
 *
 * @author <a href="mailto:hellokaton@gmail.com" target="_blank">hellokaton</a>
 */
@Slf4j
public class Router implements Application {

    private final List<RouteNode> routes = new CopyOnWriteArrayList<>();
    private final List<Middleware> middleware = new CopyOnWriteArrayList<>();
    private final List<LifecycleHook> onStartup = new CopyOnWriteArrayList<>();
    private final List<LifecycleHook> onShutdown = new CopyOnWriteArrayList<>();
    private Lifespan lifespan;
    private boolean redirectSlashes = true;
    private Lumen app;

    private volatile Map<String, ResolvedRoute> endpoints = Collections.emptyMap();
    private volatile List<ResolvedRoute> mounts = Collections.emptyList();
    private AutoCloseable lifespanContext;

    public Router() {
    }

    public Router(List<? extends RouteNode> routes) {
        if (null != routes) {
            this.routes.addAll(routes);
        }
    }

    public Router routes(RouteNode... routes) {
        Collections.addAll(this.routes, routes);
        return this;
    }

    public Router middleware(Middleware... middleware) {
        Collections.addAll(this.middleware, middleware);
        return this;
    }

    public Router onStartup(List<LifecycleHook> hooks) {
        if (null != hooks) {
            this.onStartup.addAll(hooks);
        }
        return this;
    }

    public Router onShutdown(List<LifecycleHook> hooks) {
        if (null != hooks) {
            this.onShutdown.addAll(hooks);
        }
        return this;
    }

    public Router lifespan(Lifespan lifespan) {
        this.lifespan = lifespan;
        return this;
    }

    public Router redirectSlashes(boolean redirectSlashes) {
        this.redirectSlashes = redirectSlashes;
        return this;
    }

    public Router app(Lumen app) {
        this.app = app;
        return this;
    }

    public List<RouteNode> getRoutes() {
        return Collections.unmodifiableList(routes);
    }

    public List<Middleware> getMiddleware() {
        return Collections.unmodifiableList(middleware);
    }

    public List<LifecycleHook> getOnStartup() {
        return Collections.unmodifiableList(onStartup);
    }

    public List<LifecycleHook> getOnShutdown() {
        return Collections.unmodifiableList(onShutdown);
    }

    public Lifespan getLifespan() {
        return lifespan;
    }

    public Gateway addRoute(String path, HttpHandler handler) {
        Gateway gateway = Gateway.of(path, handler);
        routes.add(gateway);
        return gateway;
    }

    public void addRoute(RouteNode route) {
        routes.add(route);
    }

    /**
     * Add a documentation view, replacing one previously added under the same path.
     */
    public void addApiView(Gateway gateway) {
        routes.removeIf(route -> route instanceof Gateway && route.getPath().equals(gateway.getPath()));
        routes.add(gateway);
    }

    /**
     * Resolve the route tree into dispatch targets.
     */
    public void register() {
        if (null != lifespan && (!onStartup.isEmpty() || !onShutdown.isEmpty())) {
            throw new ImproperlyConfiguredException("Use either 'lifespan' or 'on_startup'/'on_shutdown', not both.");
        }
        List<Permission> appPermissions = Collections.emptyList();
        List<Interceptor> appInterceptors = Collections.emptyList();
        if (null != app && null != app.getConfig()) {
            appPermissions = app.getConfig().getPermissions();
            appInterceptors = app.getConfig().getInterceptors();
        }

        Map<String, ResolvedRoute> newEndpoints = new HashMap<>();
        List<ResolvedRoute> newMounts = new ArrayList<>();
        for (ResolvedRoute route : RouteAggregator.resolve(routes)) {
            route.setExceptionHandlers(ExceptionHandlerRegistry.forRoute(route));
            route.setPermissions(collect(appPermissions, route, RouteNode::getPermissions, HttpHandler::getPermissions));
            route.setInterceptors(collect(appInterceptors, route, RouteNode::getInterceptors, HttpHandler::getInterceptors));
            if (route.isMount()) {
                newMounts.add(route);
                log.debug("\tMount {} -> {}", route.getPath(), route.getTarget());
                continue;
            }
            if (newEndpoints.containsKey(route.getPath())) {
                log.warn("\tRoute {} has exist, the later declaration is ignored", route.getPath());
                continue;
            }
            newEndpoints.put(route.getPath(), route);
            log.debug("\tRoute {} -> {}", route.getPath(), ((Gateway) route.getTarget()).getHandler().getMethods());
        }
        newMounts.sort(Comparator.comparingInt((ResolvedRoute r) -> r.getPath().length()).reversed());
        this.endpoints = Collections.unmodifiableMap(newEndpoints);
        this.mounts = Collections.unmodifiableList(newMounts);
    }

    private static <T> List<T> collect(List<T> appLevel, ResolvedRoute route,
                                       Function<RouteNode, List<T>> fromNode,
                                       Function<HttpHandler, List<T>> fromHandler) {
        List<T> items = new ArrayList<>(appLevel);
        for (Include include : route.getAncestors()) {
            items.addAll(fromNode.apply(include));
        }
        items.addAll(fromNode.apply(route.getTarget()));
        if (route.getTarget() instanceof Gateway) {
            items.addAll(fromHandler.apply(((Gateway) route.getTarget()).getHandler()));
        }
        return Collections.unmodifiableList(items);
    }

    public ResolvedRoute lookup(String path) {
        return endpoints.get(PathKit.fixPath(path));
    }

    @Override
    public void handle(RouteContext context) throws Exception {
        String path = context.path();
        String fixed = PathKit.fixPath(path);
        boolean trailingSlash = path.length() > 1 && path.endsWith("/");
        if (!trailingSlash) {
            ResolvedRoute endpoint = endpoints.get(fixed);
            if (null != endpoint) {
                handleEndpoint(endpoint, context);
                return;
            }
        } else if (redirectSlashes && endpoints.containsKey(fixed)) {
            context.response().redirect(context.rootPath() + fixed, 307);
            return;
        }
        for (ResolvedRoute mount : mounts) {
            if (PathKit.isUnder(mount.getPath(), fixed)) {
                handleMount(mount, context);
                return;
            }
        }
        throw new NotFoundException("Not Found");
    }

    private void handleEndpoint(ResolvedRoute route, RouteContext context) throws Exception {
        HttpHandler handler = ((Gateway) route.getTarget()).getHandler();
        HttpMethod method;
        try {
            method = context.request().httpMethod();
        } catch (IllegalArgumentException e) {
            throw new HttpException(405, "Method Not Allowed");
        }
        if (!handler.allows(method)) {
            throw new HttpException(405, "Method Not Allowed");
        }
        try {
            for (Interceptor interceptor : route.getInterceptors()) {
                interceptor.intercept(context);
            }
            for (Permission permission : route.getPermissions()) {
                if (!permission.hasPermission(context)) {
                    throw new PermissionDeniedException("You do not have permission to perform this action.");
                }
            }
            handler.getHandler().handle(context);
        } catch (Exception e) {
            ExceptionHandler exceptionHandler = routeExceptionHandler(route, e);
            if (null == exceptionHandler) {
                throw e;
            }
            log.debug("Route {} handled {}", route.getPath(), e.getClass().getName());
            context.response().reset();
            exceptionHandler.handle(context, e);
        }
        applyResponseDefaults(context.response());
    }

    /**
     * Handler for an error raised on a route. Typed handlers win over any
     * catch-all: the route's own typed handlers, then the application's
     * typed handlers. The route's error handler only takes errors nothing
     * typed claims, and never an {@link HttpException}, which the exception
     * boundary renders.
     *
     * @return the handler, or {@code null} to leave the error to the boundaries
     */
    private ExceptionHandler routeExceptionHandler(ResolvedRoute route, Exception e) {
        ExceptionHandler handler = route.getExceptionHandlers().lookup(e);
        if (null == handler && null != app) {
            handler = app.getExceptionHandlerMap().lookup(e);
        }
        if (null == handler && !(e instanceof HttpException)) {
            handler = route.getExceptionHandlers().getErrorHandler();
        }
        return handler;
    }

    private void handleMount(ResolvedRoute mount, RouteContext context) throws Exception {
        Include include = (Include) mount.getTarget();
        String path = context.path();
        String rootPath = context.rootPath();
        context.path(PathKit.strip(mount.getPath(), PathKit.fixPath(path)));
        context.rootPath("/".equals(mount.getPath()) ? rootPath : rootPath + mount.getPath());
        try {
            include.getApp().handle(context);
        } finally {
            context.path(path);
            context.rootPath(rootPath);
        }
    }

    private void applyResponseDefaults(Response response) {
        if (null == app || null == app.getConfig()) {
            return;
        }
        AppConfig config = app.getConfig();
        for (Map.Entry<String, String> header : config.getResponseHeaders().entrySet()) {
            if (null == response.header(header.getKey())) {
                response.header(header.getKey(), header.getValue());
            }
        }
        for (Cookie cookie : config.getResponseCookies()) {
            if (null == response.cookie(cookie.getName())) {
                response.cookie(cookie);
            }
        }
    }

    /**
     * Run the lifespan callback, or the startup hooks in order.
     */
    public void startup() throws Exception {
        if (null != lifespan) {
            lifespanContext = lifespan.open(app);
            return;
        }
        for (LifecycleHook hook : onStartup) {
            hook.run();
        }
    }

    /**
     * Close the lifespan context, or run the shutdown hooks in order.
     */
    public void shutdown() throws Exception {
        if (null != lifespan) {
            if (null != lifespanContext) {
                AutoCloseable context = lifespanContext;
                lifespanContext = null;
                context.close();
            }
            return;
        }
        for (LifecycleHook hook : onShutdown) {
            hook.run();
        }
    }

}
