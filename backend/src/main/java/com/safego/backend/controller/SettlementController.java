package com.safego.backend.controller;

import com.safego.backend.dto.NegativeBalanceView;
import com.safego.backend.dto.SettlementRestriction;
import com.safego.backend.exception.NotFoundException;
import com.safego.backend.model.UserRole;
import com.safego.backend.security.SettlementGated;
import com.safego.backend.security.SettlementScope;
import com.safego.backend.security.UserPrincipal;
import com.safego.backend.service.SettlementEnforcementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Settlement status for drivers and restaurants, plus preflight checks that other services call
 * before letting the caller accept work.
 */
@RestController
@RequestMapping("/api/settlement")
@RequiredArgsConstructor
@Tag(name = "Settlement")
public class SettlementController {

    private final SettlementEnforcementService settlementEnforcementService;

    @GetMapping("/status")
    @Operation(summary = "Whether the caller is restricted until they settle")
    public ResponseEntity<SettlementRestriction> status(@AuthenticationPrincipal UserPrincipal principal) {
        UserPrincipal caller = RequestContexts.requirePrincipal(principal);
        return ResponseEntity.ok(settlementEnforcementService.checkRestriction(caller.getUserId(), caller.getRole()));
    }

    @GetMapping("/balance")
    @Operation(summary = "The caller's negative balance ledger")
    public ResponseEntity<NegativeBalanceView> balance(@AuthenticationPrincipal UserPrincipal principal) {
        UserPrincipal caller = RequestContexts.requirePrincipal(principal);
        return UserRole.fromWire(caller.getRole())
                .flatMap(UserRole::settlementOwner)
                .map(ownerType -> ResponseEntity.ok(settlementEnforcementService.getBalance(ownerType, caller.getUserId())))
                .orElseThrow(() -> new NotFoundException("No settlement balance for this account"));
    }

    @PostMapping("/rides/accept-check")
    @SettlementGated(SettlementScope.DRIVER)
    @Operation(summary = "Preflight for a driver accepting a ride")
    public ResponseEntity<Map<String, Boolean>> rideAcceptCheck() {
        return ResponseEntity.ok(Map.of("allowed", true));
    }

    @PostMapping("/orders/accept-check")
    @SettlementGated(SettlementScope.RESTAURANT)
    @Operation(summary = "Preflight for a restaurant accepting an order")
    public ResponseEntity<Map<String, Boolean>> orderAcceptCheck() {
        return ResponseEntity.ok(Map.of("allowed", true));
    }

    @PostMapping("/write-check")
    @SettlementGated
    @Operation(summary = "Preflight for any state-changing partner operation")
    public ResponseEntity<Map<String, Boolean>> writeCheck() {
        return ResponseEntity.ok(Map.of("allowed", true));
    }
}
