package com.hellokaton.lumen.mvc;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-request stack of resources released in reverse registration order.
 * <p>
 * Every resource is closed even when an earlier one fails; the first failure
 * is rethrown with the later ones attached as suppressed exceptions.
 */
@Slf4j
public class ExitStack implements AutoCloseable {

    private final Deque<AutoCloseable> resources = new ArrayDeque<>();
    private boolean closed;

    public <T extends AutoCloseable> T push(T resource) {
        if (closed) {
            throw new IllegalStateException("ExitStack already closed");
        }
        resources.push(resource);
        return resource;
    }

    public int size() {
        return resources.size();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws Exception {
        closed = true;
        Exception failure = null;
        while (!resources.isEmpty()) {
            AutoCloseable resource = resources.pop();
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Release resource {} error", resource, e);
                if (null == failure) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (null != failure) {
            throw failure;
        }
    }

}
