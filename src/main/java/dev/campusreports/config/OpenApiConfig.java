package dev.campusreports.config;

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

@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI campusReportsOpenAPI() {
        final String securitySchemeName = "bearerAuth";

        return new OpenAPI()
                .info(new Info()
                        .title("Campus Reports API")
                        .description("""
                                Lifecycle and collaboration engine for campus facility reports.

                                ## Features
                                - Report filing and the campus feed
                                - Coordinator assignment with workload balancing
                                - Reject / start / complete transitions with status notes
                                - Private staff conversation per report
                                - Upvotes and unseen-activity counts

                                ## Authentication
                                Protected endpoints require a JWT token in the Authorization header:
                                `Authorization: Bearer <token>`

                                Obtain a token from `/api/v1/auth/login`.
                                """)
                        .version(appVersion))
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Development Server")))
                .addSecurityItem(new SecurityRequirement().addList(securitySchemeName))
                .components(new Components()
                        .addSecuritySchemes(securitySchemeName,
                                new SecurityScheme()
                                        .name(securitySchemeName)
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("JWT issued by /api/v1/auth/login")));
    }
}
