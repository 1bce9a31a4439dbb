package com.hellokaton.lumen;

/**
 * Plugged into an application once it is fully built.
 */
@FunctionalInterface
public interface Extension {

    void plug(Lumen app);

}
