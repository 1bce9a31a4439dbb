package com.hellokaton.lumen.mvc.middleware;

import com.hellokaton.lumen.config.CorsConfig;
import com.hellokaton.lumen.mvc.Application;
import com.hellokaton.lumen.mvc.RouteContext;
import com.hellokaton.lumen.mvc.http.Request;
import com.hellokaton.lumen.mvc.http.Response;
import org.junit.Test;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

public class CorsMiddlewareTest {

    private final Application app = ctx -> ctx.text("ok");

    private RouteContext ctx(Request request) {
        return new RouteContext(request, new Response());
    }

    @Test
    public void testSimpleRequestFromAllowedOrigin() throws Exception {
        CorsMiddleware middleware = new CorsMiddleware(app, new CorsConfig()
                .allowOrigins("https://a.com")
                .exposeHeaders("X-Total"));
        RouteContext context = ctx(Request.of("GET", "/").header("Origin", "https://a.com"));
        middleware.handle(context);

        assertEquals("ok", context.response().body());
        assertEquals("https://a.com", context.response().header("Access-Control-Allow-Origin"));
        assertEquals("Origin", context.response().header("Vary"));
        assertEquals("X-Total", context.response().header("Access-Control-Expose-Headers"));
    }

    @Test
    public void testSimpleRequestFromUnknownOrigin() throws Exception {
        CorsMiddleware middleware = new CorsMiddleware(app, new CorsConfig().allowOrigins("https://a.com"));
        RouteContext context = ctx(Request.of("GET", "/").header("Origin", "https://evil.com"));
        middleware.handle(context);

        assertEquals("ok", context.response().body());
        assertNull(context.response().header("Access-Control-Allow-Origin"));
    }

    @Test
    public void testAllowAllAndRegex() throws Exception {
        CorsMiddleware any = new CorsMiddleware(app, new CorsConfig().allowOrigins("*"));
        RouteContext context = ctx(Request.of("GET", "/").header("Origin", "https://b.com"));
        any.handle(context);
        assertEquals("*", context.response().header("Access-Control-Allow-Origin"));

        CorsMiddleware regex = new CorsMiddleware(app, new CorsConfig().allowOriginRegex("https://.*\\.example\\.com"));
        assertTrue(regex.isAllowedOrigin("https://shop.example.com"));
        assertFalse(regex.isAllowedOrigin("https://example.org"));
    }

    @Test
    public void testNoOriginPassesThrough() throws Exception {
        Application inner = mock(Application.class);
        RouteContext context = ctx(Request.of("GET", "/"));
        new CorsMiddleware(inner, new CorsConfig().allowOrigins("*")).handle(context);
        verify(inner).handle(context);
        assertNull(context.response().header("Access-Control-Allow-Origin"));
    }

    @Test
    public void testPreflightAllowed() throws Exception {
        Application inner = mock(Application.class);
        CorsMiddleware middleware = new CorsMiddleware(inner, new CorsConfig()
                .allowOrigins("https://a.com")
                .allowMethods("get", "post")
                .allowHeaders("X-Token")
                .allowCredentials(true));
        RouteContext context = ctx(Request.of("OPTIONS", "/orders")
                .header("Origin", "https://a.com")
                .header("Access-Control-Request-Method", "POST")
                .header("Access-Control-Request-Headers", "x-token"));
        middleware.handle(context);

        verify(inner, never()).handle(any(RouteContext.class));
        assertEquals(200, context.response().status());
        assertEquals("https://a.com", context.response().header("Access-Control-Allow-Origin"));
        assertEquals("GET, POST", context.response().header("Access-Control-Allow-Methods"));
        assertEquals("X-Token", context.response().header("Access-Control-Allow-Headers"));
        assertEquals("600", context.response().header("Access-Control-Max-Age"));
        assertEquals("true", context.response().header("Access-Control-Allow-Credentials"));
    }

    @Test
    public void testPreflightRejected() throws Exception {
        CorsMiddleware middleware = new CorsMiddleware(app, new CorsConfig().allowOrigins("https://a.com"));
        RouteContext context = ctx(Request.of("OPTIONS", "/orders")
                .header("Origin", "https://evil.com")
                .header("Access-Control-Request-Method", "DELETE")
                .header("Access-Control-Request-Headers", "X-Other"));
        middleware.handle(context);

        assertEquals(400, context.response().status());
        assertEquals("Disallowed CORS origin, method, headers", context.response().body());
    }

}
