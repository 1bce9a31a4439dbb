package com.hellokaton.lumen.mvc.hook;

import com.hellokaton.lumen.mvc.Application;

/**
 * Constructs a middleware layer around the next application.
 *
 * @param <O> the options bound at declaration time
 */
@FunctionalInterface
public interface MiddlewareFactory<O> {

    Application create(Application app, O options);

}
