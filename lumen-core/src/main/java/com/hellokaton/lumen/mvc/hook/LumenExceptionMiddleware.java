package com.hellokaton.lumen.mvc.hook;

import com.hellokaton.lumen.mvc.Application;
import com.hellokaton.lumen.mvc.RouteContext;
import com.hellokaton.lumen.mvc.handler.ExceptionHandler;
import com.hellokaton.lumen.mvc.handler.ExceptionHandlerMap;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Outermost layer of every application. Handles errors escaping the user
 * middleware with the most specific typed handler, falling back to the
 * error handler. Anything still unhandled is logged and rethrown.
 */
@Slf4j
@Getter
public class LumenExceptionMiddleware implements Application {

    private final Application app;
    private final ExceptionHandlerMap handlers;
    private final boolean debug;

    public LumenExceptionMiddleware(Application app, ExceptionHandlerMap handlers, boolean debug) {
        this.app = app;
        this.handlers = handlers;
        this.debug = debug;
    }

    @Override
    public void handle(RouteContext context) throws Exception {
        try {
            app.handle(context);
        } catch (Exception e) {
            ExceptionHandler handler = handlers.resolve(e);
            if (null == handler) {
                log.error("Unhandled error on {} {}", context.method(), context.uri(), e);
                throw e;
            }
            if (debug) {
                log.debug("Handling {} raised on {} {}", e.getClass().getName(), context.method(), context.uri(), e);
            }
            context.response().reset();
            handler.handle(context, e);
        }
    }

}
