package com.safego.backend.security;

import com.safego.backend.exception.ApiErrorWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 401 body. A bearer token that reached this point was expired, revoked or forged, which is reported
 * as {@code SESSION_INVALID} so clients know to refresh or sign in again.
 */
@Component
@RequiredArgsConstructor
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    public static final String SESSION_INVALID = "SESSION_INVALID";

    private final ApiErrorWriter apiErrorWriter;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        boolean bearerPresented = header != null && header.startsWith("Bearer ");
        apiErrorWriter.write(response, bearerPresented
                ? apiErrorWriter.builder(HttpStatus.UNAUTHORIZED, SESSION_INVALID, "Session expired or revoked", request).build()
                : apiErrorWriter.builder(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Authentication required", request).build());
    }
}
