package com.hellokaton.lumen.mvc.http;

import java.util.Locale;

/**
 * Http request methods.
 */
public enum HttpMethod {

    GET, POST, PUT, PATCH, DELETE, HEAD, OPTIONS, TRACE, CONNECT;

    /**
     * Safe methods never change server state and are exempt from CSRF checks.
     */
    public boolean isSafe() {
        return this == GET || this == HEAD || this == OPTIONS || this == TRACE;
    }

    public static HttpMethod of(String method) {
        return HttpMethod.valueOf(method.trim().toUpperCase(Locale.ROOT));
    }

}
