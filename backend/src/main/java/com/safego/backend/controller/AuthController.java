package com.safego.backend.controller;

import com.safego.backend.dto.AuthResponse;
import com.safego.backend.dto.DeviceContext;
import com.safego.backend.dto.LoginRequest;
import com.safego.backend.dto.LoginResult;
import com.safego.backend.dto.RefreshRequest;
import com.safego.backend.dto.RevokeResponse;
import com.safego.backend.dto.TokenPair;
import com.safego.backend.security.UserPrincipal;
import com.safego.backend.service.AuthenticationFlowService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Authentication Controller
 * Password login, refresh-token rotation and logout
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication")
public class AuthController {

    private final AuthenticationFlowService authenticationFlowService;

    @PostMapping("/login")
    @Operation(summary = "Log in with email, phone or user id and receive a token pair")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        DeviceContext device = RequestContexts.device(httpRequest)
                .deviceId(request.getDeviceId())
                .deviceFingerprint(request.getDeviceFingerprint())
                .deviceName(request.getDeviceName())
                .deviceModel(request.getDeviceModel())
                .osName(request.getOsName())
                .osVersion(request.getOsVersion())
                .appVersion(request.getAppVersion())
                .platform(request.getPlatform())
                .country(request.getCountry())
                .city(request.getCity())
                .build();
        LoginResult result = authenticationFlowService.login(request.getIdentifier(), request.getPassword(), device);
        return ResponseEntity.ok(AuthResponse.of(result.tokens(), result.userId(), result.role()));
    }

    @PostMapping("/refresh")
    @Operation(summary = "Exchange a refresh token for the next token pair of the same session")
    public ResponseEntity<AuthResponse> refresh(@Valid @RequestBody RefreshRequest request, HttpServletRequest httpRequest) {
        DeviceContext device = RequestContexts.device(httpRequest)
                .deviceId(request.getDeviceId())
                .deviceFingerprint(request.getDeviceFingerprint())
                .build();
        TokenPair pair = authenticationFlowService.refresh(request.getRefreshToken(), device);
        return ResponseEntity.ok(AuthResponse.of(pair, null, null));
    }

    @PostMapping("/logout")
    @Operation(summary = "End the current session")
    public ResponseEntity<RevokeResponse> logout(@AuthenticationPrincipal UserPrincipal principal) {
        int revoked = authenticationFlowService.logout(RequestContexts.requirePrincipal(principal));
        return ResponseEntity.ok(new RevokeResponse(revoked));
    }

    @PostMapping("/logout-all")
    @Operation(summary = "End every session of the current user")
    public ResponseEntity<RevokeResponse> logoutAll(@AuthenticationPrincipal UserPrincipal principal) {
        int revoked = authenticationFlowService.logoutAll(RequestContexts.requirePrincipal(principal));
        return ResponseEntity.ok(new RevokeResponse(revoked));
    }
}
