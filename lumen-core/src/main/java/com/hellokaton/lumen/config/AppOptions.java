package com.hellokaton.lumen.config;

import com.hellokaton.lumen.mvc.route.RouteNode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Options given explicitly when creating an application. Anything not
 * supplied here is taken from the {@link LumenSettings}.
 * <pre>
 *     Lumen app = Lumen.create(new AppOptions()
 *             .title("orders")
 *             .allowedHosts("*.example.com")
 *             .routes(Gateway.get("/health", ctx -&gt; ctx.text("ok"))));
 * </pre>
 */
@Getter
public class AppOptions extends ConfigSource<AppOptions> {

    private LumenSettings settings;
    private Class<? extends LumenSettings> settingsClass;
    private final List<RouteNode> routes = new ArrayList<>();

    public AppOptions settings(LumenSettings settings) {
        this.settings = settings;
        return this;
    }

    /**
     * Settings type instantiated through its public no-argument constructor.
     */
    public AppOptions settingsClass(Class<? extends LumenSettings> settingsClass) {
        this.settingsClass = settingsClass;
        return this;
    }

    public AppOptions routes(RouteNode... routes) {
        Collections.addAll(this.routes, routes);
        return this;
    }

    @Override
    protected AppOptions self() {
        return this;
    }

}
