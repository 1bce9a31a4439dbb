package com.hellokaton.lumen.mvc;

/**
 * A callable layer of the request chain. Routers, middleware and whole
 * applications all implement it; a middleware receives the next
 * {@code Application} at construction and decides whether to call it.
 */
@FunctionalInterface
public interface Application {

    void handle(RouteContext context) throws Exception;

}
