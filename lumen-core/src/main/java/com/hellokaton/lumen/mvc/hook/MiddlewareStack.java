package com.hellokaton.lumen.mvc.hook;

import com.hellokaton.lumen.mvc.Application;
import com.hellokaton.lumen.mvc.RouteContext;
import lombok.Getter;

import java.util.List;

/**
 * The built chain: layer declarations, outermost first, and the wrapped
 * application. Immutable once built, so one stack serves every request.
 */
@Getter
public class MiddlewareStack implements Application {

    private final List<Middleware> layers;
    private final Application app;

    MiddlewareStack(List<Middleware> layers, Application app) {
        this.layers = layers;
        this.app = app;
    }

    public int count(Class<? extends Application> type) {
        int count = 0;
        for (Middleware layer : layers) {
            if (layer.getType() == type) {
                count++;
            }
        }
        return count;
    }

    @Override
    public void handle(RouteContext context) throws Exception {
        app.handle(context);
    }

}
