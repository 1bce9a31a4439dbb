package com.hellokaton.lumen;

import com.hellokaton.lumen.config.AppConfig;
import com.hellokaton.lumen.config.AppOptions;
import com.hellokaton.lumen.config.ConfigMerger;
import com.hellokaton.lumen.config.LumenSettings;
import com.hellokaton.lumen.config.OpenApiConfig;
import com.hellokaton.lumen.config.StaticFilesConfig;
import com.hellokaton.lumen.exception.ImproperlyConfiguredException;
import com.hellokaton.lumen.mvc.Application;
import com.hellokaton.lumen.mvc.RouteContext;
import com.hellokaton.lumen.mvc.StaticFiles;
import com.hellokaton.lumen.mvc.handler.DefaultExceptionHandlers;
import com.hellokaton.lumen.mvc.handler.ExceptionHandler;
import com.hellokaton.lumen.mvc.handler.ExceptionHandlerMap;
import com.hellokaton.lumen.mvc.handler.ExceptionHandlerRegistry;
import com.hellokaton.lumen.mvc.handler.ExceptionKey;
import com.hellokaton.lumen.mvc.handler.HttpHandler;
import com.hellokaton.lumen.mvc.hook.Middleware;
import com.hellokaton.lumen.mvc.hook.MiddlewareStack;
import com.hellokaton.lumen.mvc.hook.MiddlewareStackBuilder;
import com.hellokaton.lumen.mvc.http.Request;
import com.hellokaton.lumen.mvc.http.Response;
import com.hellokaton.lumen.mvc.route.Gateway;
import com.hellokaton.lumen.mvc.route.Include;
import com.hellokaton.lumen.mvc.route.RouteNode;
import com.hellokaton.lumen.mvc.route.Router;
import com.hellokaton.lumen.scheduler.Scheduler;
import com.hellokaton.lumen.template.TemplateEngine;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Lumen application.
 * <p>
 * Construction merges the explicit options with the settings defaults,
 * sets up the router and builds the exception handler map and the
 * middleware chain. Adding routes, middleware or exception handlers
 * afterwards rebuilds both, so a change is visible to the next request.
 * <pre>
 *     Lumen app = Lumen.create(new AppOptions()
 *             .routes(Gateway.get("/hello", ctx -&gt; ctx.text("hello"))));
 *     Response response = app.call(Request.of("GET", "/hello"));
 * </pre>
 *
 * @author <a href="mailto:hellokaton@gmail.com" target="_blank">hellokaton</a>
 */
@Slf4j
public class Lumen implements Application {

    private final AppConfig config;
    private final Router router;
    private final boolean child;
    private final Map<ExceptionKey, ExceptionHandler> exceptionHandlers = new LinkedHashMap<>();
    private final List<Middleware> middleware = new CopyOnWriteArrayList<>();
    private final Map<String, Object> state = new ConcurrentHashMap<>();
    private final TemplateEngine templateEngine;
    private final Scheduler scheduler;

    private volatile List<Middleware> userMiddleware = Collections.emptyList();
    private volatile ExceptionHandlerMap exceptionHandlerMap = ExceptionHandlerMap.EMPTY;
    private volatile MiddlewareStack middlewareStack;
    private volatile Object openApiSchema;
    private volatile Lumen parent;

    protected Lumen(AppOptions options, boolean child) {
        LumenSettings settings = ConfigMerger.resolveSettings(options);
        this.config = ConfigMerger.merge(options, settings);
        this.child = child;
        this.exceptionHandlers.putAll(config.getExceptionHandlers());
        this.middleware.addAll(config.getMiddleware());

        // the router reads back only the merged config and the typed handler map
        this.router = new Router(options.getRoutes())
                .onStartup(config.getOnStartup())
                .onShutdown(config.getOnShutdown())
                .lifespan(config.getLifespan())
                .redirectSlashes(config.isRedirectSlashes())
                .app(this);

        for (StaticFilesConfig staticFiles : config.getStaticFilesConfig()) {
            router.addRoute(Include.mount(staticFiles.getPath(), new StaticFiles(staticFiles)));
        }

        this.templateEngine = null != config.getTemplateConfig() ? config.getTemplateConfig().createEngine() : null;

        rebuild();

        // factories below see a fully built application
        if (config.isEnableScheduler()) {
            if (null == config.getSchedulerFactory()) {
                throw new ImproperlyConfiguredException("The scheduler is enabled but no scheduler factory is configured.");
            }
            this.scheduler = config.getSchedulerFactory().create(this, config.schedulerConfig());
        } else {
            this.scheduler = null;
        }

        if (activateOpenApi()) {
            rebuild();
        }

        for (Extension extension : config.getExtensions()) {
            extension.plug(this);
        }
        log.info("{} application '{}' {} created with {} routes and {} middleware",
                child ? "Child" : "Lumen", config.getAppName(), config.getVersion(),
                router.getRoutes().size(), middlewareStack.getLayers().size());
    }

    public static Lumen create() {
        return new Lumen(new AppOptions(), false);
    }

    public static Lumen create(AppOptions options) {
        return new Lumen(options, false);
    }

    /**
     * An application meant to be mounted inside another one.
     */
    public static Lumen child(AppOptions options) {
        return new Lumen(options, true);
    }

    /**
     * Rebuild the exception handler map and the middleware chain from the
     * current routes and declarations. Calling it again without changes
     * yields the same chain.
     */
    public synchronized void rebuild() {
        router.register();
        ExceptionHandlerMap handlerMap = ExceptionHandlerRegistry.build(
                exceptionHandlers, DefaultExceptionHandlers.defaults(), router.getRoutes());
        List<Middleware> user = MiddlewareStackBuilder.buildUserMiddleware(config, middleware, router);
        MiddlewareStack stack = MiddlewareStackBuilder.build(
                user, handlerMap, router, config.isDebug(), config.getExitStackConfig());

        this.exceptionHandlerMap = handlerMap;
        this.userMiddleware = user;
        this.middlewareStack = stack;
    }

    /**
     * @return whether an api view was added to the router
     */
    private boolean activateOpenApi() {
        OpenApiConfig openApiConfig = config.getOpenApiConfig();
        if (null == openApiConfig || !config.isEnableOpenApi()) {
            return false;
        }
        this.openApiSchema = openApiConfig.createOpenApiSchema(this);
        Gateway view = openApiConfig.openApiView(this);
        if (null == view) {
            return false;
        }
        router.addApiView(view);
        return true;
    }

    private synchronized void refresh() {
        activateOpenApi();
        rebuild();
    }

    public synchronized Gateway addRoute(String path, HttpHandler handler) {
        Gateway gateway = router.addRoute(path, handler);
        refresh();
        return gateway;
    }

    public synchronized void addRoute(RouteNode route) {
        router.addRoute(route);
        refresh();
    }

    public synchronized void addInclude(Include include) {
        router.addRoute(include);
        refresh();
    }

    /**
     * Mount a child application under the path. The child keeps its own
     * middleware chain and exception handlers.
     */
    public synchronized Include addChildLumen(String path, Lumen child) {
        child.parent = this;
        Include include = Include.mount(path, child);
        router.addRoute(include);
        refresh();
        return include;
    }

    /**
     * Copy the routes and the startup/shutdown hooks of another router into
     * this application.
     */
    public synchronized void addRouter(Router other) {
        for (RouteNode route : other.getRoutes()) {
            router.addRoute(route);
        }
        router.onStartup(other.getOnStartup());
        router.onShutdown(other.getOnShutdown());
        router.middleware(other.getMiddleware().toArray(new Middleware[0]));
        refresh();
    }

    public synchronized void addMiddleware(Middleware middleware) {
        this.middleware.add(middleware);
        rebuild();
    }

    public synchronized void addExceptionHandler(Class<? extends Throwable> type, ExceptionHandler handler) {
        exceptionHandlers.put(ExceptionKey.of(type), handler);
        rebuild();
    }

    public synchronized void addExceptionHandler(int status, ExceptionHandler handler) {
        exceptionHandlers.put(ExceptionKey.of(status), handler);
        rebuild();
    }

    @Override
    public void handle(RouteContext context) throws Exception {
        Lumen previousApp = context.app();
        String previousRootPath = context.rootPath();
        context.app(this);
        if (!config.getRootPath().isEmpty()) {
            context.rootPath(config.getRootPath());
        }
        try {
            middlewareStack.handle(context);
        } finally {
            context.app(previousApp);
            context.rootPath(previousRootPath);
        }
    }

    /**
     * Dispatch a request through the middleware chain.
     */
    public Response call(Request request) throws Exception {
        RouteContext context = new RouteContext(request, new Response());
        handle(context);
        return context.response();
    }

    /**
     * Run the router lifespan, then start the scheduler.
     */
    public void startup() throws Exception {
        router.startup();
        if (null != scheduler) {
            scheduler.start();
            log.info("Scheduler started");
        }
    }

    /**
     * Stop the scheduler, then finish the router lifespan.
     */
    public void shutdown() throws Exception {
        if (null != scheduler) {
            scheduler.shutdown();
            log.info("Scheduler stopped");
        }
        router.shutdown();
    }

    public void mount(String path, Application app) {
        throw new ImproperlyConfiguredException("`mount` is not supported by Lumen. Use Include instead.");
    }

    public void host(String host, Application app) {
        throw new ImproperlyConfiguredException("`host` is not supported by Lumen.");
    }

    public void route(String path, String... methods) {
        throw new ImproperlyConfiguredException("`route` is not valid. Use Gateway instead.");
    }

    public void websocketRoute(String path) {
        throw new ImproperlyConfiguredException("`websocketRoute` is not supported by Lumen.");
    }

    public AppConfig getConfig() {
        return config;
    }

    public Router getRouter() {
        return router;
    }

    public List<Middleware> getUserMiddleware() {
        return userMiddleware;
    }

    public MiddlewareStack getMiddlewareStack() {
        return middlewareStack;
    }

    public ExceptionHandlerMap getExceptionHandlerMap() {
        return exceptionHandlerMap;
    }

    public TemplateEngine getTemplateEngine() {
        return templateEngine;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Object getOpenApiSchema() {
        return openApiSchema;
    }

    public boolean isChild() {
        return child;
    }

    public Lumen getParent() {
        return parent;
    }

    public Map<String, Object> state() {
        return state;
    }

}
