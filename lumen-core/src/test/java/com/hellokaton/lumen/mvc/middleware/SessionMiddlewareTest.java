package com.hellokaton.lumen.mvc.middleware;

import com.hellokaton.lumen.config.SessionConfig;
import com.hellokaton.lumen.kit.SignKit;
import com.hellokaton.lumen.mvc.RouteContext;
import com.hellokaton.lumen.mvc.http.Cookie;
import com.hellokaton.lumen.mvc.http.Request;
import com.hellokaton.lumen.mvc.http.Response;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class SessionMiddlewareTest {

    private final List<Map<String, Object>> seen = new ArrayList<>();

    private SessionMiddleware middleware(final String key, final Object value) {
        return new SessionMiddleware(ctx -> {
            seen.add(new java.util.HashMap<>(ctx.session()));
            if (null != key) {
                ctx.session().put(key, value);
            }
        }, new SessionConfig("session-secret"));
    }

    private RouteContext ctx(String cookie) {
        Request request = Request.of("GET", "/");
        if (null != cookie) {
            request.cookie("session", cookie);
        }
        return new RouteContext(request, new Response());
    }

    @Test
    public void testSessionRoundTrip() throws Exception {
        RouteContext first = ctx(null);
        middleware("user", "alice").handle(first);
        Cookie cookie = first.response().cookie("session");
        assertNotNull(cookie);
        assertTrue(cookie.isHttpOnly());
        assertEquals(14 * 24 * 60 * 60, cookie.getMaxAge());

        RouteContext second = ctx(cookie.getValue());
        middleware(null, null).handle(second);
        assertTrue(seen.get(0).isEmpty());
        assertEquals("alice", seen.get(1).get("user"));
    }

    @Test
    public void testTamperedCookieStartsEmptySession() throws Exception {
        RouteContext first = ctx(null);
        middleware("user", "alice").handle(first);
        String tampered = "x" + first.response().cookie("session").getValue();

        middleware(null, null).handle(ctx(tampered));
        assertTrue(seen.get(1).isEmpty());
    }

    @Test
    public void testExpiredCookieStartsEmptySession() throws Exception {
        SessionMiddleware middleware = middleware(null, null);
        String stale = SignKit.sign("session-secret", "e30", System.currentTimeMillis() / 1000 - 15 * 24 * 60 * 60);
        middleware.handle(ctx(stale));
        assertTrue(seen.get(0).isEmpty());
    }

    @Test
    public void testClearedSessionExpiresCookie() throws Exception {
        RouteContext first = ctx(null);
        middleware("user", "alice").handle(first);
        String value = first.response().cookie("session").getValue();

        RouteContext second = ctx(value);
        new SessionMiddleware(ctx -> ctx.session().clear(), new SessionConfig("session-secret")).handle(second);
        Cookie cleared = second.response().cookie("session");
        assertNotNull(cleared);
        assertEquals(0, cleared.getMaxAge());
    }

    @Test
    public void testNoCookieForEmptySession() throws Exception {
        RouteContext context = ctx(null);
        middleware(null, null).handle(context);
        assertNull(context.response().cookie("session"));
    }

}
