package com.hellokaton.lumen.scheduler;

/**
 * Background task scheduler tied to the application lifespan.
 */
public interface Scheduler {

    void start() throws Exception;

    void shutdown() throws Exception;

}
