package com.safego.backend.controller;

import com.safego.backend.config.ClientAddress;
import com.safego.backend.dto.DeviceContext;
import com.safego.backend.exception.BadRequestException;
import com.safego.backend.exception.UnauthorizedException;
import com.safego.backend.model.OwnerType;
import com.safego.backend.security.UserPrincipal;
import jakarta.servlet.http.HttpServletRequest;

final class RequestContexts {

    private RequestContexts() {
    }

    static DeviceContext.DeviceContextBuilder device(HttpServletRequest request) {
        return DeviceContext.builder()
                .ipAddress(ClientAddress.resolve(request))
                .userAgent(request.getHeader("User-Agent"));
    }

    static UserPrincipal requirePrincipal(UserPrincipal principal) {
        if (principal == null || principal.getUserId() == null) {
            throw new UnauthorizedException("Not authenticated");
        }
        return principal;
    }

    static OwnerType ownerType(String value) {
        return OwnerType.fromWire(value)
                .orElseThrow(() -> new BadRequestException("ownerType must be driver or restaurant"));
    }
}
