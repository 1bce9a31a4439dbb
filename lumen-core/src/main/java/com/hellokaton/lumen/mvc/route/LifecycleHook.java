package com.hellokaton.lumen.mvc.route;

/**
 * Startup or shutdown hook.
 */
@FunctionalInterface
public interface LifecycleHook {

    void run() throws Exception;

}
