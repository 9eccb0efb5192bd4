package com.example.tradestore.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation with JWT security
 */
@Configuration
public class OpenApiConfig {

    private static final String SECURITY_SCHEME_NAME = "bearerAuth";

    @Bean
    public OpenAPI tradeStoreOpenAPI() {
        return new OpenAPI()
                .servers(List.of(new Server().url("http://localhost:8080").description("Local development server")))
                .info(new Info()
                        .title("Trade Capture Store API")
                        .version("1.0.0")
                        .description("""
                                In-memory store for trade documents. Saves run every document through the \
                                validation pipeline; partial saves deep-merge the patch first. Lists and counts \
                                accept dotted-path filters with eq, ne, gt, gte, lt, lte, regex, in, nin and exists.


                                **Authentication:** all endpoints except health check and Swagger UI require a JWT \
                                Bearer token. Saves and deletes need the TRADE_WRITER role, admin endpoints TRADE_ADMIN."""))
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME_NAME, new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")
                                .description("JWT authentication token")))
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME));
    }
}
