package com.hellokaton.lumen.mvc;

import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class ExitStackTest {

    @Test
    public void testCloseInReverseOrder() throws Exception {
        final List<Integer> closed = new ArrayList<>();
        ExitStack stack = new ExitStack();
        stack.push(() -> closed.add(1));
        stack.push(() -> closed.add(2));
        stack.push(() -> closed.add(3));
        assertEquals(3, stack.size());

        stack.close();
        assertEquals(Arrays.asList(3, 2, 1), closed);
        assertTrue(stack.isClosed());
        assertEquals(0, stack.size());
    }

    @Test
    public void testEveryResourceClosedDespiteFailures() {
        final List<String> closed = new ArrayList<>();
        ExitStack stack = new ExitStack();
        stack.push(() -> closed.add("first"));
        stack.push(() -> {
            throw new IOException("second");
        });
        stack.push(() -> {
            throw new IllegalStateException("third");
        });
        try {
            stack.close();
            fail();
        } catch (Exception e) {
            assertEquals("third", e.getMessage());
            assertEquals(1, e.getSuppressed().length);
            assertEquals("second", e.getSuppressed()[0].getMessage());
        }
        assertEquals(Arrays.asList("first"), closed);
    }

    @Test(expected = IllegalStateException.class)
    public void testPushAfterClose() throws Exception {
        ExitStack stack = new ExitStack();
        stack.close();
        stack.push(() -> {
        });
    }

}
