package com.safego.backend.security;

import com.safego.backend.dto.SettlementRestriction;
import com.safego.backend.exception.SettlementRequiredException;
import com.safego.backend.service.SettlementEnforcementService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SettlementGateTest {

    private SettlementEnforcementService settlementEnforcementService;
    private SettlementGate gate;

    @BeforeEach
    void setUp() {
        settlementEnforcementService = mock(SettlementEnforcementService.class);
        gate = new SettlementGate(settlementEnforcementService);
        when(settlementEnforcementService.checkRestriction(anyString(), anyString()))
                .thenReturn(SettlementRestriction.restricted("Settle online to continue", new BigDecimal("1500.00")));
    }

    @Test
    void restrictedDriverIsDenied() {
        UserPrincipal driver = principal("driver-1", "driver");

        assertThat(gate.evaluate(driver, SettlementScope.DRIVER).restricted()).isTrue();
        assertThatThrownBy(() -> gate.enforce(driver, SettlementScope.ANY))
                .isInstanceOf(SettlementRequiredException.class);
    }

    @Test
    void scopeLimitsWhichRolesAreChecked() {
        UserPrincipal driver = principal("driver-1", "driver");
        UserPrincipal restaurant = principal("rest-1", "restaurant");

        assertThat(gate.evaluate(driver, SettlementScope.RESTAURANT).restricted()).isFalse();
        assertThat(gate.evaluate(restaurant, SettlementScope.DRIVER).restricted()).isFalse();
        assertThat(gate.evaluate(restaurant, SettlementScope.RESTAURANT).restricted()).isTrue();
    }

    @Test
    void adminsAndCustomersBypassWithoutLookup() {
        assertThat(gate.evaluate(principal("admin-1", "admin"), SettlementScope.ANY).restricted()).isFalse();
        assertThat(gate.evaluate(principal("cust-1", "customer"), SettlementScope.ANY).restricted()).isFalse();
        assertThat(gate.evaluate(null, SettlementScope.ANY).restricted()).isFalse();
        verify(settlementEnforcementService, never()).checkRestriction(anyString(), anyString());
    }

    private static UserPrincipal principal(String userId, String role) {
        return UserPrincipal.builder().userId(userId).role(role).tokenFamily("family").build();
    }
}
