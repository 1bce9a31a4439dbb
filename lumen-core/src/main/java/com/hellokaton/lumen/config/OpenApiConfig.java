package com.hellokaton.lumen.config;

import com.hellokaton.lumen.Lumen;
import com.hellokaton.lumen.mvc.route.Gateway;

/**
 * Hook into an OpenAPI generator. Schema generation itself lives outside
 * the framework core.
 */
public interface OpenApiConfig {

    /**
     * Build the schema document for the application's current routes.
     */
    Object createOpenApiSchema(Lumen app);

    /**
     * Gateway serving the documentation.
     */
    Gateway openApiView(Lumen app);

}
