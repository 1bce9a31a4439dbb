package com.hellokaton.lumen.config;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Cross-origin resource sharing options.
 */
@Getter
public class CorsConfig {

    private final List<String> allowOrigins = new ArrayList<>();
    private final List<String> allowMethods = new ArrayList<>(Collections.singletonList("GET"));
    private final List<String> allowHeaders = new ArrayList<>();
    private final List<String> exposeHeaders = new ArrayList<>();
    private String allowOriginRegex;
    private boolean allowCredentials;
    private int maxAge = 600;

    public CorsConfig allowOrigins(String... origins) {
        return allowOrigins(Arrays.asList(origins));
    }

    public CorsConfig allowOrigins(List<String> origins) {
        this.allowOrigins.addAll(origins);
        return this;
    }

    public CorsConfig allowMethods(String... methods) {
        this.allowMethods.clear();
        for (String method : methods) {
            this.allowMethods.add(method.toUpperCase(Locale.ROOT));
        }
        return this;
    }

    public CorsConfig allowHeaders(String... headers) {
        Collections.addAll(this.allowHeaders, headers);
        return this;
    }

    public CorsConfig exposeHeaders(String... headers) {
        Collections.addAll(this.exposeHeaders, headers);
        return this;
    }

    public CorsConfig allowOriginRegex(String allowOriginRegex) {
        this.allowOriginRegex = allowOriginRegex;
        return this;
    }

    public CorsConfig allowCredentials(boolean allowCredentials) {
        this.allowCredentials = allowCredentials;
        return this;
    }

    public CorsConfig maxAge(int maxAge) {
        this.maxAge = maxAge;
        return this;
    }

    public boolean isAllowAllOrigins() {
        return allowOrigins.contains("*");
    }

    public boolean isAllowAllMethods() {
        return allowMethods.contains("*");
    }

    public boolean isAllowAllHeaders() {
        return allowHeaders.contains("*");
    }

}
