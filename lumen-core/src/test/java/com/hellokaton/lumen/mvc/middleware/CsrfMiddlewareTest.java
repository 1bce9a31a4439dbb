package com.hellokaton.lumen.mvc.middleware;

import com.hellokaton.lumen.config.CsrfConfig;
import com.hellokaton.lumen.mvc.Application;
import com.hellokaton.lumen.mvc.RouteContext;
import com.hellokaton.lumen.mvc.http.Cookie;
import com.hellokaton.lumen.mvc.http.Request;
import com.hellokaton.lumen.mvc.http.Response;
import org.junit.Test;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

public class CsrfMiddlewareTest {

    private final Application app = mock(Application.class);
    private final CsrfMiddleware middleware = new CsrfMiddleware(app, new CsrfConfig("csrf-secret"));

    private RouteContext ctx(Request request) {
        return new RouteContext(request, new Response());
    }

    private String issueToken() throws Exception {
        RouteContext context = ctx(Request.of("GET", "/form"));
        middleware.handle(context);
        Cookie cookie = context.response().cookie("csrftoken");
        assertNotNull(cookie);
        assertEquals("lax", cookie.getSameSite());
        return cookie.getValue();
    }

    @Test
    public void testSafeRequestReceivesToken() throws Exception {
        String token = issueToken();
        assertEquals(3, token.split("\\.").length);
        verify(app).handle(any(RouteContext.class));
    }

    @Test
    public void testValidTokenIsKept() throws Exception {
        String token = issueToken();
        RouteContext context = ctx(Request.of("GET", "/form").cookie("csrftoken", token));
        middleware.handle(context);
        assertNull(context.response().cookie("csrftoken"));
    }

    @Test
    public void testUnsafeRequestWithMatchingToken() throws Exception {
        String token = issueToken();
        RouteContext context = ctx(Request.of("POST", "/form")
                .cookie("csrftoken", token)
                .header("X-CSRFToken", token));
        middleware.handle(context);
        verify(app).handle(context);
        assertEquals(200, context.response().status());
    }

    @Test
    public void testUnsafeRequestWithoutToken() throws Exception {
        RouteContext context = ctx(Request.of("POST", "/form"));
        middleware.handle(context);
        assertEquals(403, context.response().status());
        assertEquals("CSRF token verification failed", context.response().body());
        verify(app, never()).handle(any(RouteContext.class));
    }

    @Test
    public void testMismatchedToken() throws Exception {
        String token = issueToken();
        RouteContext context = ctx(Request.of("DELETE", "/form")
                .cookie("csrftoken", token)
                .header("X-CSRFToken", token + "x"));
        middleware.handle(context);
        assertEquals(403, context.response().status());
    }

    @Test
    public void testForgedTokenIsRejected() throws Exception {
        String forged = "abc.1700000000.forged";
        RouteContext context = ctx(Request.of("PUT", "/form")
                .cookie("csrftoken", forged)
                .header("X-CSRFToken", forged));
        middleware.handle(context);
        assertEquals(403, context.response().status());
        verify(app, never()).handle(any(RouteContext.class));
    }

}
