package com.example.checkout.infrastructure.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI checkoutServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Checkout Service API")
                        .description("""
                                Order lifecycle and inventory consistency for the storefront.

                                ## Flow

                                1. `POST /api/checkout` creates a **pending** order and registers it with the payment provider
                                2. `POST /api/checkout/verify` checks the payment signature, confirms the order and commits stock
                                3. Operators move orders through `processing → shipped → delivered`

                                Cancelling an order that holds stock returns that stock to inventory.

                                ## Identity

                                The gateway forwards `X-User-Id`. Operator endpoints also require `X-User-Role: admin`.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Checkout Team")
                                .email("checkout@example.com")))
                .components(new Components()
                        .addSecuritySchemes("userId", new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-User-Id")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
