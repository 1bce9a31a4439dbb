package com.hellokaton.lumen.mvc.hook;

import com.hellokaton.lumen.exception.HttpException;
import com.hellokaton.lumen.mvc.Application;
import com.hellokaton.lumen.mvc.RouteContext;
import com.hellokaton.lumen.mvc.handler.DefaultExceptionHandlers;
import com.hellokaton.lumen.mvc.handler.ExceptionHandler;
import com.hellokaton.lumen.mvc.handler.ExceptionHandlerMap;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Catch-all boundary between the user middleware and the router.
 * <p>
 * Resolution order: the most specific typed handler, the built-in
 * rendering of {@link HttpException}, the error handler. An error matching
 * none of them is rethrown to the outer boundary.
 */
@Slf4j
@Getter
public class ExceptionMiddleware implements Application {

    private final Application app;
    private final ExceptionHandlerMap handlers;
    private final boolean debug;

    public ExceptionMiddleware(Application app, ExceptionHandlerMap handlers, boolean debug) {
        this.app = app;
        this.handlers = handlers;
        this.debug = debug;
    }

    @Override
    public void handle(RouteContext context) throws Exception {
        try {
            app.handle(context);
        } catch (Exception e) {
            ExceptionHandler handler = handlers.lookup(e);
            if (null == handler && e instanceof HttpException) {
                handler = DefaultExceptionHandlers.HTTP_EXCEPTION;
            }
            if (null == handler) {
                handler = handlers.getErrorHandler();
            }
            if (null == handler) {
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
