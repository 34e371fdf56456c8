package com.pmsuite.orchestrator.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:9000}")
    private int serverPort;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("PM Suite Orchestrator")
                        .version("1.0.0")
                        .description("""
                                Single entry point for the PM suite microservices.

                                ## Authentication

                                Obtain a bearer token from `/api/v1/auth/login` or `/api/v1/auth/register`
                                and send it as `Authorization: Bearer <token>`. The token carries the
                                active organization; switch with `/api/v1/auth/switch-organization`.

                                ## Composite endpoints

                                - `/api/v1/health` - per-backend health, never fails because a backend is down
                                - `/api/v1/dashboard` - merged view with per-section error markers
                                - `/api/v1/research/collaborations` - lab collaboration suggestions

                                ## Proxied services

                                - **Atlas** (`/api/v1/projects/**`, `/api/v1/tasks/**`, `/api/v1/issues/**`)
                                - **WorkPulse** (`/api/v1/activity/**`, `/api/v1/productivity/**`)
                                - **EPR** (`/api/v1/goals/**`, `/api/v1/reviews/**`, `/api/v1/feedback/**`, `/api/v1/analytics/**`)
                                - **Labs** (`/api/v1/research/**`)
                                """))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development")))
                .components(new Components()
                        .addSecuritySchemes("bearerAuth", new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")
                                .description("JWT token from /api/v1/auth/login")))
                .addSecurityItem(new SecurityRequirement()
                        .addList("bearerAuth"));
    }
}
