package com.safego.backend.exception;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.safego.backend.config.RequestCorrelationFilter;
import com.safego.backend.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;

/**
 * Builds {@link ApiError} bodies stamped with the request and correlation ids, for the exception
 * handler as well as the filters and interceptors that answer before a controller runs.
 */
@Component
@RequiredArgsConstructor
public class ApiErrorWriter {

    public static final String SETTLEMENT_REQUIRED = "SETTLEMENT_REQUIRED";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ApiError.ApiErrorBuilder builder(HttpStatus status, String errorCode, String message, HttpServletRequest request) {
        return ApiError.builder()
                .timestamp(clock.instant())
                .path(request.getRequestURI())
                .status(status.value())
                .error(status.getReasonPhrase())
                .errorCode(errorCode)
                .message(message)
                .requestId(MDC.get(RequestCorrelationFilter.REQUEST_ID_KEY))
                .correlationId(MDC.get(RequestCorrelationFilter.CORRELATION_ID_KEY));
    }

    public void write(HttpServletResponse response, ApiError error) throws IOException {
        response.setStatus(error.getStatus());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}
