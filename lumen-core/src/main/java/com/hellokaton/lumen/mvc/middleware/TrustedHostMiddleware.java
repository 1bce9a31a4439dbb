package com.hellokaton.lumen.mvc.middleware;

import com.hellokaton.lumen.exception.ImproperlyConfiguredException;
import com.hellokaton.lumen.mvc.Application;
import com.hellokaton.lumen.mvc.RouteContext;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rejects requests whose {@code Host} header matches none of the allowed
 * hosts with a 400 response. A wildcard may only lead a pattern, as in
 * {@code *.example.com}; {@code *} alone allows every host.
 */
@Slf4j
public class TrustedHostMiddleware implements Application {

    private final Application app;
    private final List<GlobMatch> allowedHosts = new ArrayList<>();
    private final boolean allowAny;

    public TrustedHostMiddleware(Application app, List<String> allowedHosts) {
        this.app = app;
        this.allowAny = allowedHosts.contains("*");
        for (String host : allowedHosts) {
            if ("*".equals(host)) {
                continue;
            }
            int wildcard = host.lastIndexOf('*');
            if (wildcard > 0 || (wildcard == 0 && !host.startsWith("*."))) {
                throw new ImproperlyConfiguredException("Domain wildcard patterns must be like '*.example.com', got '" + host + "'");
            }
            this.allowedHosts.add(GlobMatch.compile(host));
        }
    }

    public List<GlobMatch> getAllowedHosts() {
        return Collections.unmodifiableList(allowedHosts);
    }

    @Override
    public void handle(RouteContext context) throws Exception {
        if (allowAny || isAllowed(context.request().host())) {
            app.handle(context);
            return;
        }
        log.debug("Rejected host '{}' on {} {}", context.request().host(), context.method(), context.uri());
        context.status(400).text("Invalid host header");
    }

    private boolean isAllowed(String host) {
        for (GlobMatch pattern : allowedHosts) {
            if (pattern.matches(host)) {
                return true;
            }
        }
        return false;
    }

}
