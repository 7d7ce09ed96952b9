package com.safego.backend.config;

import com.safego.backend.exception.ApiErrorWriter;
import com.safego.backend.security.RestAccessDeniedHandler;
import com.safego.backend.security.RestAuthenticationEntryPoint;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    private static final String BEARER_SCHEME = "bearerAuth";

    @Bean
    public OpenAPI safeGoAuthOpenApi() {
        SecurityScheme bearerScheme = new SecurityScheme()
                .type(SecurityScheme.Type.HTTP)
                .scheme("bearer")
                .bearerFormat("JWT")
                .description("Access token from /api/auth/login or /api/auth/refresh");
        return new OpenAPI()
                .info(new Info()
                        .title("SafeGo Auth Core API")
                        .description("Sessions, login throttling, suspicious login alerts and settlement enforcement. "
                                + "Error bodies carry an errorCode: " + RestAuthenticationEntryPoint.SESSION_INVALID
                                + " when a presented session is expired or revoked, "
                                + RestAccessDeniedHandler.ADMIN_REQUIRED + " on admin routes, "
                                + ApiErrorWriter.SETTLEMENT_REQUIRED + " with the outstanding balance when a driver or "
                                + "restaurant must settle first, and TOO_MANY_REQUESTS with a Retry-After header.")
                        .version("1.0"))
                .components(new Components().addSecuritySchemes(BEARER_SCHEME, bearerScheme))
                .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME));
    }

    @Bean
    public GroupedOpenApi clientApi() {
        return GroupedOpenApi.builder()
                .group("client")
                .pathsToMatch("/api/auth/**", "/api/security/**", "/api/settlement/**")
                .build();
    }

    @Bean
    public GroupedOpenApi adminApi() {
        return GroupedOpenApi.builder()
                .group("admin")
                .pathsToMatch("/api/admin/**")
                .build();
    }
}
