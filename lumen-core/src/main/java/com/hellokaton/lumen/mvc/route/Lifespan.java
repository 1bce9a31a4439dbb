package com.hellokaton.lumen.mvc.route;

import com.hellokaton.lumen.Lumen;

/**
 * Lifespan callback: opened on startup, the returned context is closed on
 * shutdown. Mutually exclusive with startup and shutdown hooks.
 */
@FunctionalInterface
public interface Lifespan {

    AutoCloseable open(Lumen app) throws Exception;

}
