package com.safego.backend.exception;

import com.safego.backend.dto.ApiError;
import com.safego.backend.dto.ApiErrorDetail;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final ApiErrorWriter apiErrorWriter;

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getBindingResult().getFieldErrors().stream()
                .map(this::toDetail)
                .collect(Collectors.toList());
        return respond(HttpStatus.BAD_REQUEST, baseError(HttpStatus.BAD_REQUEST, "Validation failed", request)
                .details(details).build(), request, null);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraint(ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getConstraintViolations().stream()
                .map(violation -> ApiErrorDetail.builder()
                        .field(violation.getPropertyPath().toString())
                        .issue(violation.getMessage())
                        .build())
                .collect(Collectors.toList());
        return respond(HttpStatus.BAD_REQUEST, baseError(HttpStatus.BAD_REQUEST, "Validation failed", request)
                .details(details).build(), request, null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return simple(HttpStatus.BAD_REQUEST, "Malformed request body", request, null);
    }

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ApiError> handleBadRequest(BadRequestException ex, HttpServletRequest request) {
        return simple(HttpStatus.BAD_REQUEST, ex.getMessage(), request, null);
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ApiError> handleUnauthorized(UnauthorizedException ex, HttpServletRequest request) {
        return simple(HttpStatus.UNAUTHORIZED, ex.getMessage(), request, null);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ApiError> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        return simple(HttpStatus.FORBIDDEN, "Forbidden", request, null);
    }

    @ExceptionHandler(SettlementRequiredException.class)
    public ResponseEntity<ApiError> handleSettlementRequired(SettlementRequiredException ex, HttpServletRequest request) {
        ApiError error = baseError(HttpStatus.FORBIDDEN, ex.getMessage(), request)
                .errorCode(ApiErrorWriter.SETTLEMENT_REQUIRED)
                .settlementRequired(true)
                .balance(ex.getBalance())
                .build();
        return respond(HttpStatus.FORBIDDEN, error, request, null);
    }

    @ExceptionHandler(TooManyRequestsException.class)
    public ResponseEntity<ApiError> handleTooManyRequests(TooManyRequestsException ex, HttpServletRequest request) {
        ApiError error = baseError(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage(), request)
                .retryAt(ex.getRetryAt())
                .build();
        log.info("{} {} -> 429 {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header("Retry-After", String.valueOf(ex.getRetryAfterSeconds()))
                .body(error);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        return simple(HttpStatus.NOT_FOUND, ex.getMessage(), request, null);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiError> handleConflict(ConflictException ex, HttpServletRequest request) {
        return simple(HttpStatus.CONFLICT, ex.getMessage(), request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        return simple(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", request, ex);
    }

    private ApiErrorDetail toDetail(FieldError error) {
        return ApiErrorDetail.builder()
                .field(error.getField())
                .issue(error.getDefaultMessage())
                .build();
    }

    private ResponseEntity<ApiError> simple(HttpStatus status, String message, HttpServletRequest request, Exception ex) {
        return respond(status, baseError(status, message, request).build(), request, ex);
    }

    private ApiError.ApiErrorBuilder baseError(HttpStatus status, String message, HttpServletRequest request) {
        return apiErrorWriter.builder(status, status.name(), message, request)
                .details(List.of());
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, ApiError error, HttpServletRequest request, Exception ex) {
        if (status.is5xxServerError()) {
            log.error("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), status.value(), error.getMessage(), ex);
        } else {
            log.info("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), status.value(), error.getMessage());
        }
        return ResponseEntity.status(status).body(error);
    }
}
