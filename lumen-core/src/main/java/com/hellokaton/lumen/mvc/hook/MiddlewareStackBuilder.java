package com.hellokaton.lumen.mvc.hook;

import com.hellokaton.lumen.config.AppConfig;
import com.hellokaton.lumen.config.ExitStackConfig;
import com.hellokaton.lumen.mvc.Application;
import com.hellokaton.lumen.mvc.handler.ExceptionHandlerMap;
import com.hellokaton.lumen.mvc.middleware.CorsMiddleware;
import com.hellokaton.lumen.mvc.middleware.CsrfMiddleware;
import com.hellokaton.lumen.mvc.middleware.SessionMiddleware;
import com.hellokaton.lumen.mvc.middleware.TrustedHostMiddleware;
import com.hellokaton.lumen.mvc.route.Gateway;
import com.hellokaton.lumen.mvc.route.Include;
import com.hellokaton.lumen.mvc.route.RouteAggregator;
import com.hellokaton.lumen.mvc.route.RouteNode;
import com.hellokaton.lumen.mvc.route.Router;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Assembles the middleware chain of an application.
 * <p>
 * Layers run in declaration order, outermost first:
 * <ol>
 *   <li>{@link LumenExceptionMiddleware}</li>
 *   <li>built-ins: trusted host, CORS, CSRF, session, each only when configured</li>
 *   <li>middleware declared on the application</li>
 *   <li>middleware declared on the router</li>
 *   <li>middleware declared on routes, a group before its children</li>
 *   <li>{@link ExceptionMiddleware}</li>
 *   <li>{@link ExitStackMiddleware}</li>
 * </ol>
 * and the router is the innermost target.
 */
@Slf4j
public final class MiddlewareStackBuilder {

    private MiddlewareStackBuilder() {
    }

    public static List<Middleware> buildUserMiddleware(AppConfig config, List<Middleware> appMiddleware, Router router) {
        List<Middleware> userMiddleware = new ArrayList<>();
        if (!config.getAllowedHosts().isEmpty()) {
            userMiddleware.add(Middleware.of(TrustedHostMiddleware.class, TrustedHostMiddleware::new, config.getAllowedHosts()));
        }
        if (null != config.getCorsConfig()) {
            userMiddleware.add(Middleware.of(CorsMiddleware.class, CorsMiddleware::new, config.getCorsConfig()));
        }
        if (null != config.getCsrfConfig()) {
            userMiddleware.add(Middleware.of(CsrfMiddleware.class, CsrfMiddleware::new, config.getCsrfConfig()));
        }
        if (null != config.getSessionConfig()) {
            userMiddleware.add(Middleware.of(SessionMiddleware.class, SessionMiddleware::new, config.getSessionConfig()));
        }
        userMiddleware.addAll(appMiddleware);
        userMiddleware.addAll(router.getMiddleware());
        userMiddleware.addAll(routeMiddleware(router.getRoutes()));
        return Collections.unmodifiableList(userMiddleware);
    }

    /**
     * Middleware contributed by the route tree. Nested applications
     * contribute nothing, they run their own stack.
     */
    public static List<Middleware> routeMiddleware(List<? extends RouteNode> routes) {
        return RouteAggregator.collect(routes, MiddlewareStackBuilder::declaredMiddleware);
    }

    static List<Middleware> declaredMiddleware(RouteNode node) {
        if (node instanceof Include && ((Include) node).isApplicationBoundary()) {
            return Collections.emptyList();
        }
        List<Middleware> middleware = new ArrayList<>(node.getMiddleware());
        if (node instanceof Gateway) {
            middleware.addAll(((Gateway) node).getHandler().getMiddleware());
        }
        return middleware;
    }

    public static MiddlewareStack build(List<Middleware> userMiddleware, final ExceptionHandlerMap handlers,
                                        Application router, final boolean debug, final ExitStackConfig exitStackConfig) {
        List<Middleware> layers = new ArrayList<>(userMiddleware.size() + 3);
        layers.add(Middleware.of(LumenExceptionMiddleware.class, app -> new LumenExceptionMiddleware(app, handlers, debug)));
        layers.addAll(userMiddleware);
        layers.add(Middleware.of(ExceptionMiddleware.class, app -> new ExceptionMiddleware(app, handlers, debug)));
        layers.add(Middleware.of(ExitStackMiddleware.class, ExitStackMiddleware::new, exitStackConfig));

        Application app = router;
        for (int i = layers.size() - 1; i >= 0; i--) {
            app = layers.get(i).wrap(app);
        }
        log.debug("Middleware stack built with {} layers: {}", layers.size(), layers);
        return new MiddlewareStack(Collections.unmodifiableList(layers), app);
    }

}
