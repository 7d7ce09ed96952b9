package com.safego.backend.service;

import com.safego.backend.dto.NegativeBalanceView;
import com.safego.backend.dto.SettlementRestriction;
import com.safego.backend.exception.BadRequestException;
import com.safego.backend.exception.ConflictException;
import com.safego.backend.exception.NotFoundException;
import com.safego.backend.model.OwnerType;
import com.safego.backend.repository.DriverNegativeBalanceRepository;
import com.safego.backend.repository.RestaurantNegativeBalanceRepository;
import com.safego.backend.repository.SettlementThresholdRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class SettlementEnforcementServiceTest {

    @Autowired
    private SettlementEnforcementService settlementEnforcementService;

    @Autowired
    private DriverNegativeBalanceRepository driverBalanceRepository;

    @Autowired
    private RestaurantNegativeBalanceRepository restaurantBalanceRepository;

    @Autowired
    private SettlementThresholdRepository thresholdRepository;

    @BeforeEach
    void setUp() {
        driverBalanceRepository.deleteAll();
        restaurantBalanceRepository.deleteAll();
        thresholdRepository.deleteAll();
        settlementEnforcementService.upsertThreshold(OwnerType.DRIVER, new BigDecimal("1000.00"), true, "admin-1");
        settlementEnforcementService.upsertThreshold(OwnerType.RESTAURANT, new BigDecimal("5000.00"), true, "admin-1");
    }

    @Test
    void customersAndAdminsAreNeverRestricted() {
        assertThat(settlementEnforcementService.checkRestriction("cust-1", "customer").restricted()).isFalse();
        assertThat(settlementEnforcementService.checkRestriction("admin-1", "admin").restricted()).isFalse();
        assertThat(settlementEnforcementService.checkRestriction("x-1", "unknown").restricted()).isFalse();
    }

    @Test
    void driverWithoutLedgerIsNotRestricted() {
        SettlementRestriction restriction = settlementEnforcementService.checkRestriction("driver-new", "driver");

        assertThat(restriction.restricted()).isFalse();
        assertThat(restriction.balance()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void crossingTheLimitRestrictsDriver() {
        settlementEnforcementService.accrueCashCommission(OwnerType.DRIVER, "driver-1", new BigDecimal("999.00"),
                new BigDecimal("4000.00"), "BD");
        assertThat(settlementEnforcementService.checkRestriction("driver-1", "driver").restricted()).isFalse();

        settlementEnforcementService.accrueCashCommission(OwnerType.DRIVER, "driver-1", new BigDecimal("2.00"),
                new BigDecimal("10.00"), "BD");
        SettlementRestriction restriction = settlementEnforcementService.checkRestriction("driver-1", "driver");

        assertThat(restriction.restricted()).isTrue();
        assertThat(restriction.balance()).isEqualByComparingTo("1001.00");
        assertThat(restriction.reason()).contains("1001.00").contains("1000.00");
        NegativeBalanceView ledger = settlementEnforcementService.getBalance(OwnerType.DRIVER, "driver-1");
        assertThat(ledger.restricted()).isTrue();
        assertThat(ledger.totalCashTransactions()).isEqualTo(2);
        assertThat(ledger.totalCashCollected()).isEqualByComparingTo("4010.00");
    }

    @Test
    void balanceEqualToLimitIsAllowed() {
        settlementEnforcementService.accrueCashCommission(OwnerType.DRIVER, "driver-2", new BigDecimal("1000.00"), null, null);

        assertThat(settlementEnforcementService.checkRestriction("driver-2", "driver").restricted()).isFalse();
    }

    @Test
    void restrictionStaysUntilAdministratorClearsIt() {
        settlementEnforcementService.accrueCashCommission(OwnerType.DRIVER, "driver-3", new BigDecimal("1500.00"), null, null);
        assertThat(settlementEnforcementService.checkRestriction("driver-3", "driver").restricted()).isTrue();

        assertThatThrownBy(() -> settlementEnforcementService.clearRestriction(OwnerType.DRIVER, "driver-3", "admin-1"))
                .isInstanceOf(ConflictException.class);

        settlementEnforcementService.creditOnlineSettlement(OwnerType.DRIVER, "driver-3", new BigDecimal("1000.00"));
        SettlementRestriction afterPayment = settlementEnforcementService.checkRestriction("driver-3", "driver");
        assertThat(afterPayment.restricted()).isTrue();
        assertThat(afterPayment.balance()).isEqualByComparingTo("500.00");

        NegativeBalanceView cleared = settlementEnforcementService.clearRestriction(OwnerType.DRIVER, "driver-3", "admin-1");
        assertThat(cleared.restricted()).isFalse();
        assertThat(settlementEnforcementService.checkRestriction("driver-3", "driver").restricted()).isFalse();
    }

    @Test
    void restaurantsUseTheirOwnThreshold() {
        settlementEnforcementService.accrueCashCommission(OwnerType.RESTAURANT, "rest-1", new BigDecimal("4999.99"), null, null);
        assertThat(settlementEnforcementService.checkRestriction("rest-1", "restaurant").restricted()).isFalse();

        settlementEnforcementService.accrueCashCommission(OwnerType.RESTAURANT, "rest-1", new BigDecimal("0.02"), null, null);
        assertThat(settlementEnforcementService.checkRestriction("rest-1", "restaurant").restricted()).isTrue();
        assertThat(settlementEnforcementService.listRestricted(OwnerType.RESTAURANT))
                .extracting(NegativeBalanceView::ownerId)
                .containsExactly("rest-1");
        assertThat(settlementEnforcementService.listRestricted(OwnerType.DRIVER)).isEmpty();
    }

    @Test
    void inactiveThresholdDoesNotRestrict() {
        settlementEnforcementService.upsertThreshold(OwnerType.DRIVER, new BigDecimal("1000.00"), false, "admin-1");
        settlementEnforcementService.accrueCashCommission(OwnerType.DRIVER, "driver-4", new BigDecimal("9000.00"), null, null);

        assertThat(settlementEnforcementService.checkRestriction("driver-4", "driver").restricted()).isFalse();
        assertThat(settlementEnforcementService.listThresholds()).hasSize(2);
    }

    @Test
    void invalidLedgerEntriesAreRejected() {
        assertThatThrownBy(() -> settlementEnforcementService.accrueCashCommission(OwnerType.DRIVER, "driver-5",
                BigDecimal.ZERO, null, null)).isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> settlementEnforcementService.creditOnlineSettlement(OwnerType.DRIVER, "driver-missing",
                BigDecimal.TEN)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> settlementEnforcementService.adjustBalance(OwnerType.DRIVER, "driver-5",
                BigDecimal.ONE.negate(), "admin-1", " ")).isInstanceOf(BadRequestException.class);
    }

    @Test
    void adjustmentsCanOnlyLowerTheBalance() {
        settlementEnforcementService.accrueCashCommission(OwnerType.DRIVER, "driver-6", new BigDecimal("10.00"), null, null);

        assertThatThrownBy(() -> settlementEnforcementService.adjustBalance(OwnerType.DRIVER, "driver-6",
                new BigDecimal("5000.00"), "admin-1", "manual correction"))
                .isInstanceOf(BadRequestException.class);
        assertThat(settlementEnforcementService.getBalance(OwnerType.DRIVER, "driver-6").currentBalance())
                .isEqualByComparingTo("10.00");

        NegativeBalanceView adjusted = settlementEnforcementService.adjustBalance(OwnerType.DRIVER, "driver-6",
                new BigDecimal("-4.00"), "admin-1", "waived commission");
        assertThat(adjusted.currentBalance()).isEqualByComparingTo("6.00");
    }
}
