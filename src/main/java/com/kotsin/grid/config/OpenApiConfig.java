package com.kotsin.grid.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the grid execution module
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI gridOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Kotsin Grid Execution API")
                        .description("Hedge-mode grid engine for a single perpetual futures instrument. " +
                                    "Exposes grid state, trade records and the extreme-market protection controls.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Kotsin Development Team")
                                .email("dev@kotsin.com")))
                .servers(List.of(
                        new Server()
                                .url("/")
                                .description("Relative base URL (adapts to active environment)")));
    }
}
