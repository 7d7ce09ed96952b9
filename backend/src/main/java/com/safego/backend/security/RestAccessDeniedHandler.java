package com.safego.backend.security;

import com.safego.backend.exception.ApiErrorWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
@RequiredArgsConstructor
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    public static final String ADMIN_REQUIRED = "ADMIN_REQUIRED";

    private final ApiErrorWriter apiErrorWriter;

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        if (request.getRequestURI().startsWith("/api/admin/")) {
            apiErrorWriter.write(response, apiErrorWriter
                    .builder(HttpStatus.FORBIDDEN, ADMIN_REQUIRED, "Administrator role required", request).build());
            return;
        }
        apiErrorWriter.write(response, apiErrorWriter
                .builder(HttpStatus.FORBIDDEN, "FORBIDDEN", "Access denied", request).build());
    }
}
