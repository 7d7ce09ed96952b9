package com.safego.backend.config;

import com.safego.backend.exception.ApiErrorWriter;
import com.safego.backend.service.RateLimitService;
import com.safego.backend.service.RateLimitService.RateLimitDecision;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Slf4j
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    static final String LOGIN_PATH = "/api/auth/login";
    static final String REFRESH_PATH = "/api/auth/refresh";

    private final RateLimitService rateLimitService;
    private final ApiErrorWriter apiErrorWriter;

    public RateLimitInterceptor(RateLimitService rateLimitService, ApiErrorWriter apiErrorWriter) {
        this.rateLimitService = rateLimitService;
        this.apiErrorWriter = apiErrorWriter;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        if (!"POST".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = request.getRequestURI();
        if (LOGIN_PATH.equals(path)) {
            return handleRateLimit(rateLimitService.allowLogin(resolveKey(request)), request, response);
        }
        if (REFRESH_PATH.equals(path)) {
            return handleRateLimit(rateLimitService.allowRefresh(resolveKey(request)), request, response);
        }
        return true;
    }

    private boolean handleRateLimit(RateLimitDecision decision,
                                    HttpServletRequest request,
                                    HttpServletResponse response) throws Exception {
        if (decision.allowed()) {
            return true;
        }
        log.info("Rate limit exceeded: path={}, client={}", request.getRequestURI(), resolveKey(request));
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
        apiErrorWriter.write(response, apiErrorWriter.builder(HttpStatus.TOO_MANY_REQUESTS,
                HttpStatus.TOO_MANY_REQUESTS.name(), "Rate limit exceeded", request).build());
        return false;
    }

    private String resolveKey(HttpServletRequest request) {
        return "ip:" + ClientAddress.resolve(request);
    }
}
