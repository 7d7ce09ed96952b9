package com.safego.backend.controller;

import com.safego.backend.dto.LedgerEntryRequest;
import com.safego.backend.dto.NegativeBalanceView;
import com.safego.backend.dto.SettlementThresholdView;
import com.safego.backend.dto.ThresholdRequest;
import com.safego.backend.security.UserPrincipal;
import com.safego.backend.service.SettlementEnforcementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/admin/settlement")
@RequiredArgsConstructor
@Tag(name = "Settlement administration")
public class AdminSettlementController {

    private final SettlementEnforcementService settlementEnforcementService;

    @PostMapping("/accruals")
    @Operation(summary = "Record commission owed on a cash trip or order")
    public ResponseEntity<NegativeBalanceView> accrue(@Valid @RequestBody LedgerEntryRequest request) {
        return ResponseEntity.ok(settlementEnforcementService.accrueCashCommission(
                RequestContexts.ownerType(request.getOwnerType()), request.getOwnerId(), request.getAmount(),
                request.getCashAmount(), request.getCountryCode()));
    }

    @PostMapping("/credits")
    @Operation(summary = "Credit an online settlement payment")
    public ResponseEntity<NegativeBalanceView> credit(@Valid @RequestBody LedgerEntryRequest request) {
        return ResponseEntity.ok(settlementEnforcementService.creditOnlineSettlement(
                RequestContexts.ownerType(request.getOwnerType()), request.getOwnerId(), request.getAmount()));
    }

    @PostMapping("/adjustments")
    @Operation(summary = "Write a balance down by a negative amount")
    public ResponseEntity<NegativeBalanceView> adjust(@AuthenticationPrincipal UserPrincipal principal,
                                                      @Valid @RequestBody LedgerEntryRequest request) {
        String adminId = RequestContexts.requirePrincipal(principal).getUserId();
        return ResponseEntity.ok(settlementEnforcementService.adjustBalance(
                RequestContexts.ownerType(request.getOwnerType()), request.getOwnerId(), request.getAmount(),
                adminId, request.getReason()));
    }

    @PostMapping("/{ownerType}/{ownerId}/clear-restriction")
    @Operation(summary = "Release a settlement restriction once the balance is back under the limit")
    public ResponseEntity<NegativeBalanceView> clearRestriction(@AuthenticationPrincipal UserPrincipal principal,
                                                                @PathVariable String ownerType,
                                                                @PathVariable String ownerId) {
        String adminId = RequestContexts.requirePrincipal(principal).getUserId();
        return ResponseEntity.ok(settlementEnforcementService.clearRestriction(
                RequestContexts.ownerType(ownerType), ownerId, adminId));
    }

    @GetMapping("/{ownerType}/restricted")
    @Operation(summary = "List restricted drivers or restaurants")
    public ResponseEntity<List<NegativeBalanceView>> restricted(@PathVariable String ownerType) {
        return ResponseEntity.ok(settlementEnforcementService.listRestricted(RequestContexts.ownerType(ownerType)));
    }

    @GetMapping("/{ownerType}/{ownerId}")
    @Operation(summary = "Show one ledger")
    public ResponseEntity<NegativeBalanceView> balance(@PathVariable String ownerType, @PathVariable String ownerId) {
        return ResponseEntity.ok(settlementEnforcementService.getBalance(RequestContexts.ownerType(ownerType), ownerId));
    }

    @GetMapping("/thresholds")
    @Operation(summary = "List settlement thresholds")
    public ResponseEntity<List<SettlementThresholdView>> thresholds() {
        return ResponseEntity.ok(settlementEnforcementService.listThresholds());
    }

    @PutMapping("/thresholds")
    @Operation(summary = "Create or update the negative balance limit for an owner type")
    public ResponseEntity<SettlementThresholdView> upsertThreshold(@AuthenticationPrincipal UserPrincipal principal,
                                                                   @Valid @RequestBody ThresholdRequest request) {
        String adminId = RequestContexts.requirePrincipal(principal).getUserId();
        return ResponseEntity.ok(settlementEnforcementService.upsertThreshold(
                RequestContexts.ownerType(request.getOwnerType()), request.getThresholdValue(), request.isActive(), adminId));
    }
}
