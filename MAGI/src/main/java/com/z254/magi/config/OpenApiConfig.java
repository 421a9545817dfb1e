package com.z254.magi.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the MAGI service.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI magiOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("MAGI API")
                        .description("""
                                MAGI - three-agent deliberation engine.

                                CASPER, BALTHASAR and MELCHIOR each answer a question about a web
                                application, score each other's answers, and the best-scored answer
                                becomes the consensus.

                                ## Workflow
                                1. `POST /api/v1/magi/sessions` opens a session
                                2. `POST /api/v1/magi/sessions/{id}/step` with `propose`, then `vote`, then `consensus`

                                Provider keys travel with each step request and are never stored.
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("/").description("Current server"),
                        new Server().url("http://localhost:8090").description("Local development")
                ));
    }
}
