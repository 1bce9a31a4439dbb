package com.hellokaton.lumen.mvc.route;

import com.hellokaton.lumen.mvc.handler.HttpHandler;
import com.hellokaton.lumen.mvc.handler.RouteHandler;

/**
 * Leaf route binding a path to a single {@link HttpHandler}.
 */
public class Gateway extends AbstractRoute<Gateway> {

    private final HttpHandler handler;

    public Gateway(String path, HttpHandler handler) {
        super(path);
        if (null == handler) {
            throw new IllegalArgumentException("Gateway handler must not be null");
        }
        this.handler = handler;
    }

    public static Gateway of(String path, HttpHandler handler) {
        return new Gateway(path, handler);
    }

    public static Gateway get(String path, RouteHandler handler) {
        return new Gateway(path, HttpHandler.get(handler));
    }

    public HttpHandler getHandler() {
        return handler;
    }

    @Override
    public String toString() {
        return "Gateway(" + getPath() + " -> " + handler.getMethods() + ")";
    }

    @Override
    protected Gateway self() {
        return this;
    }

}
