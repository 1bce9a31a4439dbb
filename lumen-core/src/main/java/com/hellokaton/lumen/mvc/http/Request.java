package com.hellokaton.lumen.mvc.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * An inbound http request as seen by the middleware chain.
 * Header names are case insensitive.
 */
public class Request {

    private final String method;
    private final String path;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final Map<String, String> cookies = new LinkedHashMap<>();
    private String body;

    public Request(String method, String path) {
        this.method = method;
        this.path = path;
    }

    public static Request of(String method, String path) {
        return new Request(method, path);
    }

    public Request header(String name, String value) {
        this.headers.put(name, value);
        return this;
    }

    public Request cookie(String name, String value) {
        this.cookies.put(name, value);
        return this;
    }

    public Request body(String body) {
        this.body = body;
        return this;
    }

    public String method() {
        return method;
    }

    public HttpMethod httpMethod() {
        return HttpMethod.of(method);
    }

    public String path() {
        return path;
    }

    public String header(String name) {
        return headers.get(name);
    }

    public Map<String, String> headers() {
        return Collections.unmodifiableMap(headers);
    }

    public String cookie(String name) {
        return cookies.get(name);
    }

    public Map<String, String> cookies() {
        return Collections.unmodifiableMap(cookies);
    }

    public String body() {
        return body;
    }

    /**
     * Host header value without port.
     */
    public String host() {
        String host = header("Host");
        if (null == host) {
            return "";
        }
        int colon = host.lastIndexOf(':');
        if (colon > 0 && host.indexOf(']') < colon) {
            return host.substring(0, colon);
        }
        return host;
    }

    @Override
    public String toString() {
        return method + " " + path;
    }

}
