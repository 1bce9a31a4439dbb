package com.hellokaton.lumen.mvc.hook;

import com.hellokaton.lumen.config.ExitStackConfig;
import com.hellokaton.lumen.mvc.Application;
import com.hellokaton.lumen.mvc.ExitStack;
import com.hellokaton.lumen.mvc.RouteContext;
import lombok.Getter;

/**
 * Binds a fresh {@link ExitStack} to every request and releases it before
 * control leaves this layer, whether the request succeeded or failed.
 * <p>
 * A release failure is attached as suppressed to an error already in
 * flight, otherwise it is thrown. The stack of an enclosing application is
 * restored on the way out.
 */
@Getter
public class ExitStackMiddleware implements Application {

    private final Application app;
    private final ExitStackConfig config;

    public ExitStackMiddleware(Application app, ExitStackConfig config) {
        this.app = app;
        this.config = config;
    }

    @Override
    public void handle(RouteContext context) throws Exception {
        ExitStack previous = context.hasExitStack() ? context.exitStack() : null;
        ExitStack stack = new ExitStack();
        context.exitStack(stack);
        context.attribute(config.getContextName(), stack);
        Exception failure = null;
        try {
            app.handle(context);
        } catch (Exception e) {
            failure = e;
            throw e;
        } finally {
            context.exitStack(previous);
            context.attribute(config.getContextName(), previous);
            try {
                stack.close();
            } catch (Exception releaseError) {
                if (null == failure) {
                    throw releaseError;
                }
                failure.addSuppressed(releaseError);
            }
        }
    }

}
