package com.safego.backend.security;

import com.safego.backend.dto.SettlementRestriction;
import com.safego.backend.exception.SettlementRequiredException;
import com.safego.backend.model.UserRole;
import com.safego.backend.service.SettlementEnforcementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Request-time settlement check for a caller. Evaluated on every call without caching.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SettlementGate {

    private final SettlementEnforcementService settlementEnforcementService;

    public SettlementRestriction evaluate(UserPrincipal principal, SettlementScope scope) {
        if (principal == null || principal.getUserId() == null) {
            return SettlementRestriction.notRestricted();
        }
        Optional<UserRole> role = UserRole.fromWire(principal.getRole());
        boolean applies;
        switch (scope) {
            case DRIVER:
                applies = role.filter(r -> r == UserRole.DRIVER).isPresent();
                break;
            case RESTAURANT:
                applies = role.filter(r -> r == UserRole.RESTAURANT).isPresent();
                break;
            default:
                applies = role.filter(r -> r == UserRole.ADMIN || r == UserRole.CUSTOMER).isEmpty();
                break;
        }
        if (!applies) {
            return SettlementRestriction.notRestricted();
        }
        SettlementRestriction restriction = settlementEnforcementService.checkRestriction(principal.getUserId(), principal.getRole());
        if (restriction.restricted()) {
            log.info("Settlement gate denied userId={} role={} scope={}", principal.getUserId(), principal.getRole(), scope);
        }
        return restriction;
    }

    /**
     * @throws SettlementRequiredException if the caller is restricted for this scope
     */
    public void enforce(UserPrincipal principal, SettlementScope scope) {
        SettlementRestriction restriction = evaluate(principal, scope);
        if (restriction.restricted()) {
            throw new SettlementRequiredException(restriction.reason(), restriction.balance());
        }
    }
}
