package com.safego.backend.controller;

import com.safego.backend.dto.AuthResponse;
import com.safego.backend.dto.ClearBlocksRequest;
import com.safego.backend.dto.DeviceContext;
import com.safego.backend.dto.DeviceView;
import com.safego.backend.dto.IssueTokenRequest;
import com.safego.backend.dto.LoginAttemptView;
import com.safego.backend.dto.ReviewAlertRequest;
import com.safego.backend.dto.RevokeRequest;
import com.safego.backend.dto.RevokeResponse;
import com.safego.backend.dto.SecurityAlertView;
import com.safego.backend.dto.SecurityDashboard;
import com.safego.backend.dto.SessionSummary;
import com.safego.backend.dto.TokenPair;
import com.safego.backend.exception.BadRequestException;
import com.safego.backend.model.UserRole;
import com.safego.backend.security.UserPrincipal;
import com.safego.backend.service.DeviceHistoryService;
import com.safego.backend.service.LoginThrottleService;
import com.safego.backend.service.SecurityDashboardService;
import com.safego.backend.service.SessionTokenService;
import com.safego.backend.service.SuspiciousLoginService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/security")
@RequiredArgsConstructor
@Tag(name = "Security administration")
public class AdminSecurityController {

    private static final String DEFAULT_REVOKE_REASON = "Revoked by administrator";

    private final SessionTokenService sessionTokenService;
    private final LoginThrottleService loginThrottleService;
    private final DeviceHistoryService deviceHistoryService;
    private final SuspiciousLoginService suspiciousLoginService;
    private final SecurityDashboardService securityDashboardService;

    @PostMapping("/tokens")
    @Operation(summary = "Issue a session for a user")
    public ResponseEntity<AuthResponse> issueTokens(@Valid @RequestBody IssueTokenRequest request,
                                                    HttpServletRequest httpRequest) {
        String role = UserRole.fromWire(request.getUserRole())
                .map(UserRole::wireName)
                .orElseThrow(() -> new BadRequestException("Unknown role: " + request.getUserRole()));
        DeviceContext device = RequestContexts.device(httpRequest)
                .deviceId(request.getDeviceId())
                .deviceFingerprint(request.getDeviceFingerprint())
                .build();
        TokenPair pair = sessionTokenService.issue(request.getUserId(), role, request.getEmail(), device);
        return ResponseEntity.ok(AuthResponse.of(pair, request.getUserId(), role));
    }

    @PostMapping("/users/{userId}/revoke")
    @Operation(summary = "Revoke every session of a user")
    public ResponseEntity<RevokeResponse> revokeUser(@PathVariable String userId,
                                                     @Valid @RequestBody(required = false) RevokeRequest request) {
        return ResponseEntity.ok(new RevokeResponse(sessionTokenService.revokeAll(userId, reasonOf(request))));
    }

    @PostMapping("/families/{tokenFamily}/revoke")
    @Operation(summary = "Revoke one session")
    public ResponseEntity<RevokeResponse> revokeFamily(@PathVariable String tokenFamily,
                                                       @Valid @RequestBody(required = false) RevokeRequest request) {
        return ResponseEntity.ok(new RevokeResponse(sessionTokenService.revokeFamily(tokenFamily, reasonOf(request))));
    }

    @GetMapping("/users/{userId}/sessions")
    @Operation(summary = "List a user's sessions")
    public ResponseEntity<List<SessionSummary>> userSessions(@PathVariable String userId,
                                                             @RequestParam(defaultValue = "false") boolean activeOnly) {
        return ResponseEntity.ok(sessionTokenService.listTokens(userId, activeOnly));
    }

    @GetMapping("/users/{userId}/devices")
    @Operation(summary = "List a user's device history")
    public ResponseEntity<List<DeviceView>> userDevices(@PathVariable String userId,
                                                        @RequestParam(defaultValue = "false") boolean includeRemoved) {
        return ResponseEntity.ok(deviceHistoryService.listDevices(userId, includeRemoved));
    }

    @GetMapping("/login-attempts")
    @Operation(summary = "List recent login attempts and blocks")
    public ResponseEntity<List<LoginAttemptView>> loginAttempts(@RequestParam(required = false) String identifier,
                                                                @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(loginThrottleService.listAttempts(identifier, limit));
    }

    @PostMapping("/login-attempts/clear-blocks")
    @Operation(summary = "Clear every login block for an identifier")
    public ResponseEntity<Map<String, Integer>> clearBlocks(@AuthenticationPrincipal UserPrincipal principal,
                                                            @Valid @RequestBody ClearBlocksRequest request) {
        String adminId = RequestContexts.requirePrincipal(principal).getUserId();
        int cleared = loginThrottleService.clearBlocks(request.getIdentifier(), adminId);
        return ResponseEntity.ok(Map.of("cleared", cleared));
    }

    @GetMapping("/alerts")
    @Operation(summary = "List security alerts")
    public ResponseEntity<List<SecurityAlertView>> alerts(@RequestParam(required = false) String userId,
                                                          @RequestParam(required = false) Boolean acknowledged,
                                                          @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(suspiciousLoginService.listAlerts(userId, acknowledged, limit));
    }

    @PostMapping("/alerts/{alertId}/review")
    @Operation(summary = "Record an administrator review of an alert")
    public ResponseEntity<SecurityAlertView> reviewAlert(@AuthenticationPrincipal UserPrincipal principal,
                                                         @PathVariable Long alertId,
                                                         @Valid @RequestBody ReviewAlertRequest request) {
        String adminId = RequestContexts.requirePrincipal(principal).getUserId();
        return ResponseEntity.ok(suspiciousLoginService.reviewAlert(alertId, adminId, request.getReviewNote()));
    }

    @GetMapping("/dashboard")
    @Operation(summary = "Security counters for today")
    public ResponseEntity<SecurityDashboard> dashboard() {
        return ResponseEntity.ok(securityDashboardService.snapshot());
    }

    @PostMapping("/tokens/cleanup")
    @Operation(summary = "Delete token records past refresh expiry")
    public ResponseEntity<Map<String, Integer>> cleanupTokens() {
        return ResponseEntity.ok(Map.of("deleted", sessionTokenService.cleanupExpired()));
    }

    private static String reasonOf(RevokeRequest request) {
        if (request == null || request.getReason() == null || request.getReason().isBlank()) {
            return DEFAULT_REVOKE_REASON;
        }
        return request.getReason();
    }
}
