package com.safego.backend.config;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Client IP for a request, preferring the first {@code X-Forwarded-For} hop.
 */
public final class ClientAddress {

    private ClientAddress() {
    }

    public static String resolve(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return request.getRemoteAddr();
    }
}
