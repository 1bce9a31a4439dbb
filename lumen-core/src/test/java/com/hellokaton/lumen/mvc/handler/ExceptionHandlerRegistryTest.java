package com.hellokaton.lumen.mvc.handler;

import com.hellokaton.lumen.Lumen;
import com.hellokaton.lumen.config.AppOptions;
import com.hellokaton.lumen.exception.ImproperlyConfiguredException;
import com.hellokaton.lumen.exception.ValidationErrorException;
import com.hellokaton.lumen.mvc.route.Gateway;
import com.hellokaton.lumen.mvc.route.Include;
import com.hellokaton.lumen.mvc.route.ResolvedRoute;
import com.hellokaton.lumen.mvc.route.RouteAggregator;
import com.hellokaton.lumen.mvc.route.RouteNode;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;
import static org.mockito.Mockito.mock;

public class ExceptionHandlerRegistryTest {

    private static final RouteHandler OK = ctx -> ctx.text("ok");

    @Test
    public void testDefaultsFillGaps() {
        ExceptionHandlerMap map = ExceptionHandlerRegistry.build(null, DefaultExceptionHandlers.defaults(), Collections.<RouteNode>emptyList());
        assertSame(DefaultExceptionHandlers.IMPROPERLY_CONFIGURED, map.lookup(new ImproperlyConfiguredException("bad")));
        assertSame(DefaultExceptionHandlers.VALIDATION_ERROR, map.lookup(new ValidationErrorException("invalid")));
        assertFalse(map.hasErrorHandler());
    }

    @Test
    public void testExplicitHandlerKeepsPriorityOverDefault() {
        ExceptionHandler custom = mock(ExceptionHandler.class);
        Map<ExceptionKey, ExceptionHandler> explicit = new LinkedHashMap<>();
        explicit.put(ExceptionKey.of(ValidationErrorException.class), custom);

        ExceptionHandlerMap map = ExceptionHandlerRegistry.build(explicit, DefaultExceptionHandlers.defaults(), Collections.<RouteNode>emptyList());
        assertSame(custom, map.lookup(new ValidationErrorException("invalid")));
        assertSame(DefaultExceptionHandlers.IMPROPERLY_CONFIGURED, map.lookup(new ImproperlyConfiguredException("bad")));
    }

    @Test
    public void testDeeperDeclarationWins() {
        ExceptionHandler outer = mock(ExceptionHandler.class);
        ExceptionHandler gateway = mock(ExceptionHandler.class);
        ExceptionHandler handler = mock(ExceptionHandler.class);
        Map<ExceptionKey, ExceptionHandler> explicit = new LinkedHashMap<>();
        explicit.put(ExceptionKey.of(IllegalStateException.class), mock(ExceptionHandler.class));

        List<RouteNode> routes = Collections.<RouteNode>singletonList(
                Include.of("/api",
                        Gateway.of("/a", HttpHandler.get(OK).exceptionHandler(IllegalArgumentException.class, handler))
                                .exceptionHandler(IllegalArgumentException.class, gateway))
                        .exceptionHandler(IllegalStateException.class, outer));

        ExceptionHandlerMap map = ExceptionHandlerRegistry.build(explicit, DefaultExceptionHandlers.defaults(), routes);
        assertSame(outer, map.lookup(new IllegalStateException()));
        assertSame(handler, map.lookup(new IllegalArgumentException()));
    }

    @Test
    public void testNestedApplicationIsOpaque() {
        ExceptionHandler inner = mock(ExceptionHandler.class);
        Lumen child = Lumen.child(new AppOptions().routes(
                Gateway.get("/boom", OK).exceptionHandler(IllegalStateException.class, inner)));
        List<RouteNode> routes = Collections.<RouteNode>singletonList(Include.mount("/child", child));

        ExceptionHandlerMap map = ExceptionHandlerRegistry.build(null, DefaultExceptionHandlers.defaults(), routes);
        assertNull(map.lookup(new IllegalStateException()));
        assertSame(inner, child.getExceptionHandlerMap().lookup(new IllegalStateException()));
    }

    @Test
    public void testRouteCatchAllBecomesErrorHandler() {
        ExceptionHandler catchAll = mock(ExceptionHandler.class);
        List<RouteNode> routes = Collections.<RouteNode>singletonList(Gateway.get("/", OK).exceptionHandler(Exception.class, catchAll));

        ExceptionHandlerMap map = ExceptionHandlerRegistry.build(null, DefaultExceptionHandlers.defaults(), routes);
        assertSame(catchAll, map.getErrorHandler());
        assertFalse(map.getHandlers().containsKey(ExceptionKey.of(Exception.class)));
    }

    @Test
    public void testForRouteFollowsPath() {
        ExceptionHandler group = mock(ExceptionHandler.class);
        ExceptionHandler leaf = mock(ExceptionHandler.class);
        Include api = Include.of("/api",
                Gateway.get("/a", OK).exceptionHandler(IllegalStateException.class, leaf),
                Gateway.get("/b", OK))
                .exceptionHandler(IllegalStateException.class, group);

        List<ResolvedRoute> resolved = RouteAggregator.resolve(Arrays.<RouteNode>asList(api));
        assertEquals(2, resolved.size());
        assertSame(leaf, ExceptionHandlerRegistry.forRoute(resolved.get(0)).lookup(new IllegalStateException()));
        assertSame(group, ExceptionHandlerRegistry.forRoute(resolved.get(1)).lookup(new IllegalStateException()));

        Gateway bare = Gateway.get("/bare", OK);
        List<ResolvedRoute> plain = RouteAggregator.resolve(Collections.<RouteNode>singletonList(bare));
        assertSame(ExceptionHandlerMap.EMPTY, ExceptionHandlerRegistry.forRoute(plain.get(0)));
    }

}
