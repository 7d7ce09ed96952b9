package com.safego.backend.security;

import com.safego.backend.dto.DeviceContext;
import com.safego.backend.dto.TokenPair;
import com.safego.backend.service.SessionTokenService;
import com.safego.backend.util.MutableClock;
import com.safego.backend.util.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfig.class)
class SecurityEndpointsTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SessionTokenService sessionTokenService;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock.reset();
    }

    @Test
    void healthIsPublic() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk());
    }

    @Test
    void protectedEndpointsRequireAuth() throws Exception {
        mockMvc.perform(get("/api/security/sessions"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("UNAUTHORIZED"));
        mockMvc.perform(post("/api/auth/logout"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/admin/security/dashboard"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/settlement/status").header("Authorization", "Bearer not-a-token"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void revokedSessionIsReportedAsInvalidSession() throws Exception {
        TokenPair pair = sessionTokenService.issue("cust-77", "customer", null, DeviceContext.empty());
        sessionTokenService.revokeFamily(pair.tokenFamily(), "User logout");

        mockMvc.perform(get("/api/security/sessions").header("Authorization", "Bearer " + pair.accessToken()))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value(RestAuthenticationEntryPoint.SESSION_INVALID))
                .andExpect(jsonPath("$.timestamp").value(MutableClock.DEFAULT_START.toString()));
    }

    @Test
    void nonAdminOnAdminRouteGetsAdminRequired() throws Exception {
        String customer = "Bearer " + sessionTokenService.issue("cust-78", "customer", null, DeviceContext.empty()).accessToken();

        mockMvc.perform(get("/api/admin/security/dashboard").header("Authorization", customer))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value(RestAccessDeniedHandler.ADMIN_REQUIRED))
                .andExpect(jsonPath("$.path").value("/api/admin/security/dashboard"));
    }

    @Test
    void correlationHeadersAreEchoed() throws Exception {
        mockMvc.perform(get("/api/security/sessions")
                        .header("X-Request-Id", "req-123")
                        .header("X-Correlation-Id", "corr-456"))
                .andExpect(header().string("X-Request-Id", "req-123"))
                .andExpect(header().string("X-Correlation-Id", "corr-456"));
    }
}
