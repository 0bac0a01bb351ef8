package com.platform.scaffold.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI document metadata, served at /openapi.json with the UI at /docs.
 */
@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "service-scaffold",
                version = "1.0.0",
                description = "Service scaffold with optional bearer-token auth and persistence"
        )
)
@SecurityScheme(
        name = "bearerAuth",
        type = SecuritySchemeType.HTTP,
        scheme = "bearer"
)
public class OpenApiConfig {
}
