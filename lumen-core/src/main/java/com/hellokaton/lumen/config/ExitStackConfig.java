package com.hellokaton.lumen.config;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Options of the per-request exit stack layer.
 */
@Getter
@AllArgsConstructor
public class ExitStackConfig {

    public static final ExitStackConfig DEFAULT = new ExitStackConfig("lumen.exit_stack");

    /**
     * State attribute the request's exit stack is published under.
     */
    private final String contextName;

}
