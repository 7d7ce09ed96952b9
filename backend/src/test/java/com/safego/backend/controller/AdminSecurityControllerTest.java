package com.safego.backend.controller;

import com.safego.backend.dto.DeviceContext;
import com.safego.backend.dto.TokenPair;
import com.safego.backend.repository.AuditEventRepository;
import com.safego.backend.repository.AuthTokenRepository;
import com.safego.backend.repository.LoginAttemptRepository;
import com.safego.backend.service.LoginThrottleService;
import com.safego.backend.service.SessionTokenService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AdminSecurityControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SessionTokenService sessionTokenService;

    @Autowired
    private LoginThrottleService loginThrottleService;

    @Autowired
    private AuthTokenRepository authTokenRepository;

    @Autowired
    private LoginAttemptRepository loginAttemptRepository;

    @Autowired
    private AuditEventRepository auditEventRepository;

    private String adminToken;

    @BeforeEach
    void setup() {
        authTokenRepository.deleteAll();
        loginAttemptRepository.deleteAll();
        auditEventRepository.deleteAll();
        adminToken = "Bearer " + sessionTokenService.issue("admin-1", "admin", "ops@safego.test", DeviceContext.empty())
                .accessToken();
    }

    @Test
    void adminRevokesEverySessionOfAUser() throws Exception {
        TokenPair driverSession = sessionTokenService.issue("driver-1", "driver", null, DeviceContext.empty());
        sessionTokenService.issue("driver-1", "driver", null, DeviceContext.empty());

        mockMvc.perform(post("/api/admin/security/users/driver-1/revoke")
                        .header("Authorization", adminToken)
                        .header("X-Request-Id", "req-revoke-1")
                        .header("X-Forwarded-For", "203.0.113.9, 10.0.0.1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"account review\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.revoked").value(2));

        assertThat(sessionTokenService.validate(driverSession.accessToken())).isNull();
        assertThat(auditEventRepository.findByUserIdOrderByCreatedAtDesc("driver-1"))
                .filteredOn(event -> "REVOKE_ALL".equals(event.getAction()))
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getRequestId()).isEqualTo("req-revoke-1");
                    assertThat(event.getClientIp()).isEqualTo("203.0.113.9");
                });
        mockMvc.perform(get("/api/admin/security/users/driver-1/sessions")
                        .param("activeOnly", "true")
                        .header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void adminIssuesSessionForUser() throws Exception {
        mockMvc.perform(post("/api/admin/security/tokens")
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"rest-1\",\"userRole\":\"RESTAURANT\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("restaurant"))
                .andExpect(jsonPath("$.refreshToken").isNotEmpty());

        mockMvc.perform(post("/api/admin/security/tokens")
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"rest-1\",\"userRole\":\"pilot\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void adminClearsLoginBlocks() throws Exception {
        for (int i = 0; i < 5; i++) {
            loginThrottleService.recordAttempt("rider@safego.test", "email", false, "invalid_credentials", DeviceContext.empty());
        }
        assertThat(loginThrottleService.check("rider@safego.test", "email", DeviceContext.empty()).allowed()).isFalse();

        mockMvc.perform(post("/api/admin/security/login-attempts/clear-blocks")
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identifier\":\"rider@safego.test\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cleared").value(1));

        mockMvc.perform(get("/api/admin/security/login-attempts")
                        .param("identifier", "rider@safego.test")
                        .header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(6));
    }

    @Test
    void dashboardIsAdminOnly() throws Exception {
        mockMvc.perform(get("/api/admin/security/dashboard").header("Authorization", adminToken))
                .andExpect(status().isOk());

        String customer = "Bearer " + sessionTokenService.issue("cust-1", "customer", null, DeviceContext.empty()).accessToken();
        mockMvc.perform(get("/api/admin/security/dashboard").header("Authorization", customer))
                .andExpect(status().isForbidden());
    }
}
