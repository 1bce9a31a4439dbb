package com.hellokaton.lumen.template;

import java.util.Map;

/**
 * Renders named templates.
 */
public interface TemplateEngine {

    String render(String name, Map<String, Object> context) throws Exception;

}
