package com.safego.backend.controller;

import com.safego.backend.dto.AcknowledgeAlertRequest;
import com.safego.backend.dto.DeviceView;
import com.safego.backend.dto.SecurityAlertView;
import com.safego.backend.dto.SessionSummary;
import com.safego.backend.security.UserPrincipal;
import com.safego.backend.service.DeviceHistoryService;
import com.safego.backend.service.SessionTokenService;
import com.safego.backend.service.SuspiciousLoginService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/security")
@RequiredArgsConstructor
@Tag(name = "Account security")
public class SecurityController {

    private final SessionTokenService sessionTokenService;
    private final DeviceHistoryService deviceHistoryService;
    private final SuspiciousLoginService suspiciousLoginService;

    @GetMapping("/sessions")
    @Operation(summary = "List the caller's sessions")
    public ResponseEntity<List<SessionSummary>> sessions(@AuthenticationPrincipal UserPrincipal principal,
                                                         @RequestParam(defaultValue = "true") boolean activeOnly) {
        String userId = RequestContexts.requirePrincipal(principal).getUserId();
        return ResponseEntity.ok(sessionTokenService.listTokens(userId, activeOnly));
    }

    @GetMapping("/devices")
    @Operation(summary = "List devices the caller has logged in from")
    public ResponseEntity<List<DeviceView>> devices(@AuthenticationPrincipal UserPrincipal principal,
                                                    @RequestParam(defaultValue = "false") boolean includeRemoved) {
        String userId = RequestContexts.requirePrincipal(principal).getUserId();
        return ResponseEntity.ok(deviceHistoryService.listDevices(userId, includeRemoved));
    }

    @PostMapping("/devices/{deviceId}/trust")
    @Operation(summary = "Mark one of the caller's devices as trusted")
    public ResponseEntity<DeviceView> trustDevice(@AuthenticationPrincipal UserPrincipal principal,
                                                  @PathVariable String deviceId) {
        String userId = RequestContexts.requirePrincipal(principal).getUserId();
        return ResponseEntity.ok(deviceHistoryService.trustDevice(userId, deviceId));
    }

    @DeleteMapping("/devices/{deviceId}")
    @Operation(summary = "Remove one of the caller's devices")
    public ResponseEntity<DeviceView> removeDevice(@AuthenticationPrincipal UserPrincipal principal,
                                                   @PathVariable String deviceId) {
        String userId = RequestContexts.requirePrincipal(principal).getUserId();
        return ResponseEntity.ok(deviceHistoryService.removeDevice(userId, deviceId));
    }

    @GetMapping("/alerts")
    @Operation(summary = "List the caller's security alerts")
    public ResponseEntity<List<SecurityAlertView>> alerts(@AuthenticationPrincipal UserPrincipal principal,
                                                          @RequestParam(required = false) Boolean acknowledged,
                                                          @RequestParam(defaultValue = "50") int limit) {
        String userId = RequestContexts.requirePrincipal(principal).getUserId();
        return ResponseEntity.ok(suspiciousLoginService.listAlerts(userId, acknowledged, limit));
    }

    @PostMapping("/alerts/{alertId}/acknowledge")
    @Operation(summary = "Acknowledge an alert. Reporting it as not legitimate revokes all sessions")
    public ResponseEntity<SecurityAlertView> acknowledge(@AuthenticationPrincipal UserPrincipal principal,
                                                         @PathVariable Long alertId,
                                                         @RequestBody(required = false) AcknowledgeAlertRequest request) {
        String userId = RequestContexts.requirePrincipal(principal).getUserId();
        boolean legitimate = request == null || request.getWasLegitimate() == null || request.getWasLegitimate();
        return ResponseEntity.ok(suspiciousLoginService.acknowledgeAlert(alertId, userId, legitimate));
    }
}
