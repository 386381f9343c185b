package com.numaansystems.bridge.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI description of the bridge's browser-facing routes.
 *
 * <p>Covers {@code /bridge/init} (redirect to the identity provider),
 * {@code /bridge/callback} (provider redirect target, answers with an HTML page)
 * and {@code /bridge/health}. The launcher's WebSocket at {@code /bridge/ws}
 * carries the {@code {"id","url"}} greeting and the single result message; OpenAPI
 * cannot describe it, so it is documented on {@link WebSocketConfig} instead.</p>
 *
 * <p>The optional bearer token is published as the {@value #BEARER_SCHEME} scheme.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
public class SwaggerConfig {

    static final String BEARER_SCHEME = "bearer-jwt";

    @Bean
    public OpenAPI bridgeOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Federated Login Bridge API")
                .description("Browser entry points of the launcher login: authorize redirect, "
                        + "provider callback and health. Results reach the launcher over /bridge/ws.")
                .version("0.1.0")
                .contact(new Contact()
                    .name("Numaan Systems")
                    .email("support@numaansystems.com"))
                .license(new License()
                    .name("MIT License")
                    .url("https://opensource.org/licenses/MIT")))
            .components(new Components()
                .addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                    .type(SecurityScheme.Type.HTTP)
                    .scheme("bearer")
                    .bearerFormat("JWT")
                    .description("Optional. Identifies the local user an account is linked to.")));
    }
}
