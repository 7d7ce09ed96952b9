package com.safego.backend.controller;

import com.safego.backend.dto.DeviceContext;
import com.safego.backend.model.OwnerType;
import com.safego.backend.repository.DriverNegativeBalanceRepository;
import com.safego.backend.repository.RestaurantNegativeBalanceRepository;
import com.safego.backend.repository.SettlementThresholdRepository;
import com.safego.backend.service.SessionTokenService;
import com.safego.backend.service.SettlementEnforcementService;
import com.safego.backend.util.MutableClock;
import com.safego.backend.util.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfig.class)
class SettlementControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SessionTokenService sessionTokenService;

    @Autowired
    private SettlementEnforcementService settlementEnforcementService;

    @Autowired
    private DriverNegativeBalanceRepository driverBalanceRepository;

    @Autowired
    private RestaurantNegativeBalanceRepository restaurantBalanceRepository;

    @Autowired
    private SettlementThresholdRepository thresholdRepository;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setup() {
        clock.reset();
        driverBalanceRepository.deleteAll();
        restaurantBalanceRepository.deleteAll();
        thresholdRepository.deleteAll();
        settlementEnforcementService.upsertThreshold(OwnerType.DRIVER, new BigDecimal("1000.00"), true, "admin-1");
    }

    @Test
    void restrictedDriverCannotAcceptRides() throws Exception {
        settlementEnforcementService.accrueCashCommission(OwnerType.DRIVER, "driver-1", new BigDecimal("1200.00"), null, "BD");
        String token = bearer("driver-1", "driver");

        mockMvc.perform(post("/api/settlement/rides/accept-check").header("Authorization", token))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("SETTLEMENT_REQUIRED"))
                .andExpect(jsonPath("$.settlementRequired").value(true))
                .andExpect(jsonPath("$.balance").value(1200.00))
                .andExpect(jsonPath("$.timestamp").value(MutableClock.DEFAULT_START.toString()));

        mockMvc.perform(get("/api/settlement/status").header("Authorization", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.restricted").value(true));
    }

    @Test
    void driverUnderLimitPassesGate() throws Exception {
        settlementEnforcementService.accrueCashCommission(OwnerType.DRIVER, "driver-2", new BigDecimal("10.00"), null, "BD");

        mockMvc.perform(post("/api/settlement/rides/accept-check").header("Authorization", bearer("driver-2", "driver")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(true));
        mockMvc.perform(get("/api/settlement/balance").header("Authorization", bearer("driver-2", "driver")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ownerType").value("driver"))
                .andExpect(jsonPath("$.currentBalance").value(10.00));
    }

    @Test
    void customersAreExemptFromGeneralGate() throws Exception {
        mockMvc.perform(post("/api/settlement/write-check").header("Authorization", bearer("cust-1", "customer")))
                .andExpect(status().isOk());
    }

    @Test
    void restaurantGateIgnoresRestrictedDriverOnlyForRestaurantScope() throws Exception {
        settlementEnforcementService.accrueCashCommission(OwnerType.DRIVER, "driver-3", new BigDecimal("5000.00"), null, "BD");
        String token = bearer("driver-3", "driver");

        mockMvc.perform(post("/api/settlement/orders/accept-check").header("Authorization", token))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/settlement/write-check").header("Authorization", token))
                .andExpect(status().isForbidden());
    }

    @Test
    void adminManagesThresholdsAndLedgers() throws Exception {
        String admin = bearer("admin-1", "admin");

        mockMvc.perform(put("/api/admin/settlement/thresholds")
                        .header("Authorization", admin)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerType\":\"restaurant\",\"thresholdValue\":2500}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ownerType").value("restaurant"));

        mockMvc.perform(post("/api/admin/settlement/accruals")
                        .header("Authorization", admin)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerType\":\"restaurant\",\"ownerId\":\"rest-1\",\"amount\":300,\"cashAmount\":2000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCashTransactions").value(1));

        mockMvc.perform(get("/api/admin/settlement/restaurant/rest-1").header("Authorization", admin))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentBalance").value(300.0));

        mockMvc.perform(get("/api/admin/settlement/boat/rest-1").header("Authorization", admin))
                .andExpect(status().isBadRequest());
    }

    @Test
    void nonAdminCannotReachAdminSettlement() throws Exception {
        mockMvc.perform(get("/api/admin/settlement/thresholds").header("Authorization", bearer("driver-9", "driver")))
                .andExpect(status().isForbidden());
    }

    private String bearer(String userId, String role) {
        return "Bearer " + sessionTokenService.issue(userId, role, null, DeviceContext.empty()).accessToken();
    }
}
