package com.hellokaton.lumen.mvc.middleware;

import com.hellokaton.lumen.config.CorsConfig;
import com.hellokaton.lumen.kit.StringKit;
import com.hellokaton.lumen.mvc.Application;
import com.hellokaton.lumen.mvc.RouteContext;
import com.hellokaton.lumen.mvc.http.Response;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Answers CORS preflight requests and decorates simple requests coming
 * from an allowed origin.
 */
@Getter
public class CorsMiddleware implements Application {

    private static final String ORIGIN = "Origin";
    private static final String REQUEST_METHOD = "Access-Control-Request-Method";
    private static final String REQUEST_HEADERS = "Access-Control-Request-Headers";

    private final Application app;
    private final CorsConfig config;
    private final Pattern originRegex;

    public CorsMiddleware(Application app, CorsConfig config) {
        this.app = app;
        this.config = config;
        this.originRegex = null != config.getAllowOriginRegex() ? Pattern.compile(config.getAllowOriginRegex()) : null;
    }

    @Override
    public void handle(RouteContext context) throws Exception {
        String origin = context.header(ORIGIN);
        if (null == origin) {
            app.handle(context);
            return;
        }
        if ("OPTIONS".equalsIgnoreCase(context.method()) && null != context.header(REQUEST_METHOD)) {
            preflight(context, origin);
            return;
        }
        app.handle(context);
        Response response = context.response();
        if (config.isAllowAllOrigins() && !config.isAllowCredentials()) {
            response.header("Access-Control-Allow-Origin", "*");
        } else if (isAllowedOrigin(origin)) {
            response.header("Access-Control-Allow-Origin", origin);
            response.header("Vary", "Origin");
        }
        if (config.isAllowCredentials()) {
            response.header("Access-Control-Allow-Credentials", "true");
        }
        if (!config.getExposeHeaders().isEmpty()) {
            response.header("Access-Control-Expose-Headers", String.join(", ", config.getExposeHeaders()));
        }
    }

    private void preflight(RouteContext context, String origin) {
        List<String> failures = new ArrayList<>();
        Response response = context.response();
        if (isAllowedOrigin(origin)) {
            response.header("Access-Control-Allow-Origin", config.isAllowAllOrigins() && !config.isAllowCredentials() ? "*" : origin);
            if (!config.isAllowAllOrigins() || config.isAllowCredentials()) {
                response.header("Vary", "Origin");
            }
        } else {
            failures.add("origin");
        }
        String method = context.header(REQUEST_METHOD).toUpperCase(Locale.ROOT);
        if (!config.isAllowAllMethods() && !config.getAllowMethods().contains(method)) {
            failures.add("method");
        }
        String requestHeaders = context.header(REQUEST_HEADERS);
        if (config.isAllowAllHeaders() && null != requestHeaders) {
            response.header("Access-Control-Allow-Headers", requestHeaders);
        } else {
            for (String header : StringKit.splitList(requestHeaders)) {
                if (!containsIgnoreCase(config.getAllowHeaders(), header)) {
                    failures.add("headers");
                    break;
                }
            }
            if (!config.getAllowHeaders().isEmpty()) {
                response.header("Access-Control-Allow-Headers", String.join(", ", config.getAllowHeaders()));
            }
        }
        response.header("Access-Control-Allow-Methods", String.join(", ", config.getAllowMethods()));
        response.header("Access-Control-Max-Age", String.valueOf(config.getMaxAge()));
        if (config.isAllowCredentials()) {
            response.header("Access-Control-Allow-Credentials", "true");
        }
        if (failures.isEmpty()) {
            context.status(200).text("OK");
        } else {
            context.status(400).text("Disallowed CORS " + String.join(", ", failures));
        }
    }

    public boolean isAllowedOrigin(String origin) {
        if (config.isAllowAllOrigins()) {
            return true;
        }
        if (null != originRegex && originRegex.matcher(origin).matches()) {
            return true;
        }
        return config.getAllowOrigins().contains(origin);
    }

    private static boolean containsIgnoreCase(List<String> values, String value) {
        for (String item : values) {
            if (item.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }

}
