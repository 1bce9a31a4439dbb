package com.hellokaton.lumen.template;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.function.Function;

/**
 * Template directory and the factory creating an engine for it.
 */
@Getter
@AllArgsConstructor
public class TemplateConfig {

    private final String directory;
    private final Function<String, ? extends TemplateEngine> engine;

    public TemplateEngine createEngine() {
        return engine.apply(directory);
    }

}
