package com.hellokaton.lumen.mvc;

import com.hellokaton.lumen.Lumen;
import com.hellokaton.lumen.mvc.http.Request;
import com.hellokaton.lumen.mvc.http.Response;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-request state threaded through the middleware chain.
 * <p>
 * A context is never shared between requests, which is what lets a single
 * built chain serve concurrent requests without locking.
 *
 * @author <a href="mailto:hellokaton@gmail.com" target="_blank">hellokaton</a>
 */
public class RouteContext {

    private final Request request;
    private final Response response;
    private final Map<String, Object> state = new HashMap<>();
    private Map<String, Object> session;
    private ExitStack exitStack;
    private Lumen app;
    private String path;
    private String rootPath = "";

    public RouteContext(Request request, Response response) {
        this.request = request;
        this.response = response;
        this.path = request.path();
    }

    public Request request() {
        return request;
    }

    public Response response() {
        return response;
    }

    public String method() {
        return request.method();
    }

    public String uri() {
        return request.path();
    }

    /**
     * Path still to be routed. Includes strip their prefix from it while
     * dispatching into their children.
     */
    public String path() {
        return path;
    }

    public void path(String path) {
        this.path = path;
    }

    public String rootPath() {
        return rootPath;
    }

    public void rootPath(String rootPath) {
        this.rootPath = rootPath;
    }

    public Map<String, Object> state() {
        return state;
    }

    public Object attribute(String name) {
        return state.get(name);
    }

    public RouteContext attribute(String name, Object value) {
        state.put(name, value);
        return this;
    }

    /**
     * Session data, available once the session middleware ran.
     */
    public Map<String, Object> session() {
        if (null == session) {
            throw new IllegalStateException("SessionMiddleware must be installed to access the session");
        }
        return session;
    }

    public boolean hasSession() {
        return null != session;
    }

    public void session(Map<String, Object> session) {
        this.session = session;
    }

    public ExitStack exitStack() {
        if (null == exitStack) {
            throw new IllegalStateException("No exit stack bound to this request");
        }
        return exitStack;
    }

    public boolean hasExitStack() {
        return null != exitStack;
    }

    public void exitStack(ExitStack exitStack) {
        this.exitStack = exitStack;
    }

    public Lumen app() {
        return app;
    }

    public void app(Lumen app) {
        this.app = app;
    }

    public RouteContext status(int status) {
        response.status(status);
        return this;
    }

    public RouteContext text(String text) {
        response.text(text);
        return this;
    }

    public RouteContext json(Object value) {
        response.json(value);
        return this;
    }

    public String header(String name) {
        return request.header(name);
    }

}
