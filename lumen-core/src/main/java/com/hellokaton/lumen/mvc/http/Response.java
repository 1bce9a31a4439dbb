package com.hellokaton.lumen.mvc.http;

import com.hellokaton.lumen.kit.JsonKit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The response being assembled for a single request.
 */
public class Response {

    private int status = 200;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final List<Cookie> cookies = new ArrayList<>();
    private String body;

    public int status() {
        return status;
    }

    public Response status(int status) {
        this.status = status;
        return this;
    }

    public String header(String name) {
        return headers.get(name);
    }

    public Response header(String name, String value) {
        this.headers.put(name, value);
        return this;
    }

    public Map<String, String> headers() {
        return Collections.unmodifiableMap(headers);
    }

    public Response cookie(Cookie cookie) {
        this.cookies.removeIf(c -> c.getName().equals(cookie.getName()));
        this.cookies.add(cookie);
        return this;
    }

    public Cookie cookie(String name) {
        for (Cookie cookie : cookies) {
            if (cookie.getName().equals(name)) {
                return cookie;
            }
        }
        return null;
    }

    public List<Cookie> cookies() {
        return Collections.unmodifiableList(cookies);
    }

    public String body() {
        return body;
    }

    public Response text(String text) {
        this.headers.put("Content-Type", "text/plain; charset=utf-8");
        this.body = text;
        return this;
    }

    public Response json(Object value) {
        this.headers.put("Content-Type", "application/json");
        this.body = JsonKit.toJson(value);
        return this;
    }

    public Response redirect(String location, int status) {
        this.status = status;
        this.headers.put("Location", location);
        return this;
    }

    /**
     * Drop body, headers and cookies so an error handler can start afresh.
     */
    public Response reset() {
        this.status = 200;
        this.headers.clear();
        this.cookies.clear();
        this.body = null;
        return this;
    }

}
