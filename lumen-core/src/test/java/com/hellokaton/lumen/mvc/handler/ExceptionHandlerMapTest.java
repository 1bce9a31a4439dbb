package com.hellokaton.lumen.mvc.handler;

import com.hellokaton.lumen.exception.HttpException;
import com.hellokaton.lumen.exception.NotFoundException;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;
import static org.mockito.Mockito.mock;

public class ExceptionHandlerMapTest {

    private final ExceptionHandler notFoundStatus = mock(ExceptionHandler.class);
    private final ExceptionHandler notFoundType = mock(ExceptionHandler.class);
    private final ExceptionHandler runtime = mock(ExceptionHandler.class);
    private final ExceptionHandler catchAll = mock(ExceptionHandler.class);

    @Test
    public void testPartitionCatchAllKeys() {
        ExceptionHandler serverError = mock(ExceptionHandler.class);
        Map<ExceptionKey, ExceptionHandler> merged = new LinkedHashMap<>();
        merged.put(ExceptionKey.of(Exception.class), catchAll);
        merged.put(ExceptionKey.of(RuntimeException.class), runtime);
        merged.put(ExceptionKey.of(500), serverError);

        ExceptionHandlerMap map = ExceptionHandlerMap.partition(merged);
        assertEquals(1, map.getHandlers().size());
        assertTrue(map.getHandlers().containsKey(ExceptionKey.of(RuntimeException.class)));
        assertSame(serverError, map.getErrorHandler());
        assertTrue(map.hasErrorHandler());
    }

    @Test
    public void testCatchAllNeverShadowsTypedHandler() {
        Map<ExceptionKey, ExceptionHandler> merged = new LinkedHashMap<>();
        merged.put(ExceptionKey.of(RuntimeException.class), runtime);
        merged.put(ExceptionKey.of(Throwable.class), catchAll);

        ExceptionHandlerMap map = ExceptionHandlerMap.partition(merged);
        assertSame(runtime, map.resolve(new IllegalStateException()));
        assertSame(catchAll, map.resolve(new java.io.IOException()));
    }

    @Test
    public void testStatusKeyBeforeClassHierarchy() {
        Map<ExceptionKey, ExceptionHandler> merged = new LinkedHashMap<>();
        merged.put(ExceptionKey.of(NotFoundException.class), notFoundType);
        merged.put(ExceptionKey.of(404), notFoundStatus);

        ExceptionHandlerMap map = ExceptionHandlerMap.partition(merged);
        assertSame(notFoundStatus, map.lookup(new NotFoundException("missing")));
        assertSame(notFoundStatus, map.lookup(new HttpException(404, "missing")));
        assertNull(map.lookup(new HttpException(409, "conflict")));
    }

    @Test
    public void testMostSpecificTypeWins() {
        ExceptionHandler illegalArgument = mock(ExceptionHandler.class);
        Map<ExceptionKey, ExceptionHandler> merged = new LinkedHashMap<>();
        merged.put(ExceptionKey.of(RuntimeException.class), runtime);
        merged.put(ExceptionKey.of(IllegalArgumentException.class), illegalArgument);

        ExceptionHandlerMap map = ExceptionHandlerMap.partition(merged);
        assertSame(illegalArgument, map.lookup(new NumberFormatException()));
        assertSame(runtime, map.lookup(new IllegalStateException()));
        assertNull(map.lookup(new Exception()));
    }

    @Test
    public void testUnhandled() {
        assertNull(ExceptionHandlerMap.EMPTY.resolve(new IllegalStateException()));
        assertTrue(ExceptionHandlerMap.EMPTY.isEmpty());
        assertEquals(ExceptionKey.of(404), ExceptionKey.of(404));
        assertNotEquals(ExceptionKey.of(404), ExceptionKey.of(RuntimeException.class));
    }

}
