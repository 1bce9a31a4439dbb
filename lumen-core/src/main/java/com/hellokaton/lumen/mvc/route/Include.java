package com.hellokaton.lumen.mvc.route;

import com.hellokaton.lumen.Lumen;
import com.hellokaton.lumen.mvc.Application;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Route group under a common path prefix.
 * <p>
 * An include either holds child routes or mounts an {@link Application}.
 * When the mounted application is itself a {@link Lumen} the include is a
 * nested application boundary: the inner application builds its own
 * middleware and exception handler stacks and nothing below the include is
 * merged into the parent.
 */
public class Include extends AbstractRoute<Include> {

    private final List<RouteNode> routes = new ArrayList<>();
    private final Application app;

    public Include(String path, List<? extends RouteNode> routes) {
        super(path);
        this.app = null;
        if (null != routes) {
            this.routes.addAll(routes);
        }
    }

    public Include(String path, Application app) {
        super(path);
        if (null == app) {
            throw new IllegalArgumentException("Include application must not be null");
        }
        this.app = app;
    }

    public static Include of(String path, RouteNode... routes) {
        List<RouteNode> list = new ArrayList<>();
        Collections.addAll(list, routes);
        return new Include(path, list);
    }

    public static Include mount(String path, Application app) {
        return new Include(path, app);
    }

    public List<RouteNode> getRoutes() {
        return Collections.unmodifiableList(routes);
    }

    public Application getApp() {
        return app;
    }

    public boolean isApplicationBoundary() {
        return app instanceof Lumen;
    }

    @Override
    public String toString() {
        return "Include(" + getPath() + (null != app ? " -> " + app.getClass().getSimpleName() : ", " + routes.size() + " routes") + ")";
    }

    @Override
    protected Include self() {
        return this;
    }

}
