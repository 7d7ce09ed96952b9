package com.safego.backend.service;

import com.safego.backend.config.JwtProperties;
import com.safego.backend.dto.DeviceContext;
import com.safego.backend.dto.TokenPair;
import com.safego.backend.model.AlertSeverity;
import com.safego.backend.model.AuthToken;
import com.safego.backend.model.FraudEvent;
import com.safego.backend.repository.AuthTokenRepository;
import com.safego.backend.security.JwtTokenProvider;
import com.safego.backend.security.TokenHasher;
import com.safego.backend.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionTokenServiceTest {

    private AuthTokenRepository authTokenRepository;
    private FraudEventService fraudEventService;
    private AuditEventService auditEventService;
    private MetricsService metricsService;
    private TokenHasher tokenHasher;
    private MutableClock clock;
    private SessionTokenService service;

    @BeforeEach
    void setUp() {
        JwtProperties properties = new JwtProperties();
        properties.setSecret("0123456789abcdef0123456789abcdef");
        clock = new MutableClock(MutableClock.DEFAULT_START);
        JwtTokenProvider jwtTokenProvider = new JwtTokenProvider(properties, clock);
        jwtTokenProvider.validateSecret();
        tokenHasher = new TokenHasher(properties);
        tokenHasher.init();

        authTokenRepository = mock(AuthTokenRepository.class);
        fraudEventService = mock(FraudEventService.class);
        auditEventService = mock(AuditEventService.class);
        metricsService = mock(MetricsService.class);
        service = new SessionTokenService(authTokenRepository, jwtTokenProvider, tokenHasher, properties,
                fraudEventService, auditEventService, metricsService, clock);
    }

    @Test
    void issueStartsFamilyAtVersionOneAndStoresOnlyHashes() {
        TokenPair pair = service.issue("driver-1", "driver", "d1@safego.test",
                DeviceContext.builder().deviceId("dev-1").ipAddress("10.0.0.1").build());

        ArgumentCaptor<AuthToken> saved = ArgumentCaptor.forClass(AuthToken.class);
        verify(authTokenRepository).save(saved.capture());
        AuthToken record = saved.getValue();
        assertThat(pair.tokenVersion()).isEqualTo(1);
        assertThat(record.getTokenFamily()).isEqualTo(pair.tokenFamily());
        assertThat(record.getRefreshTokenHash()).isEqualTo(tokenHasher.hash(pair.refreshToken()));
        assertThat(record.getRefreshTokenHash()).isNotEqualTo(pair.refreshToken());
        assertThat(record.getAccessExpiresAt()).isEqualTo(pair.accessExpiresAt());
        assertThat(record.getRefreshExpiresAt()).isEqualTo(MutableClock.DEFAULT_START.plus(Duration.ofDays(7)));
        assertThat(record.getDeviceId()).isEqualTo("dev-1");
        verify(metricsService).recordTokenIssued();
    }

    @Test
    void rotateIssuesNextVersionAndInheritsDevice() {
        TokenPair first = service.issue("driver-1", "driver", null, DeviceContext.builder().deviceId("dev-1").build());
        AuthToken stored = storedRecord(first, 1);
        when(authTokenRepository.findByRefreshTokenHashAndTokenFamilyAndRevokedFalse(
                tokenHasher.hash(first.refreshToken()), first.tokenFamily())).thenReturn(Optional.of(stored));
        when(authTokenRepository.markConsumed(eq(11L), any(Instant.class), eq(SessionTokenService.REASON_ROTATED)))
                .thenReturn(1);

        TokenPair second = service.rotate(first.refreshToken(), null);

        assertThat(second).isNotNull();
        assertThat(second.tokenFamily()).isEqualTo(first.tokenFamily());
        assertThat(second.tokenVersion()).isEqualTo(2);
        ArgumentCaptor<AuthToken> saved = ArgumentCaptor.forClass(AuthToken.class);
        verify(authTokenRepository, times(2)).save(saved.capture());
        assertThat(saved.getAllValues().get(1).getDeviceId()).isEqualTo("dev-1");
        verify(metricsService).recordTokenRotated();
    }

    @Test
    void reusedRefreshTokenRevokesEverySessionOfTheUser() {
        TokenPair first = service.issue("cust-9", "customer", null, DeviceContext.empty());
        when(authTokenRepository.findByRefreshTokenHashAndTokenFamilyAndRevokedFalse(anyString(), anyString()))
                .thenReturn(Optional.empty());
        when(authTokenRepository.existsByTokenFamilyAndRevokedTrue(first.tokenFamily())).thenReturn(true);
        when(authTokenRepository.revokeAllActiveForUser(eq("cust-9"), any(Instant.class), anyString())).thenReturn(3);

        TokenPair result = service.rotate(first.refreshToken(), DeviceContext.builder().ipAddress("203.0.113.9").build());

        assertThat(result).isNull();
        verify(authTokenRepository).flagReuseInFamily(eq(first.tokenFamily()), any(Instant.class));
        verify(authTokenRepository).revokeAllActiveForUser(eq("cust-9"), any(Instant.class), eq(SessionTokenService.REASON_REUSE));
        verify(fraudEventService).record(eq("cust-9"), eq(FraudEvent.TOKEN_REUSE), eq(AlertSeverity.CRITICAL),
                anyString(), anyMap());
        verify(metricsService).recordTokenReuse();
    }

    @Test
    void unknownTokenWithoutRevokedFamilyIsRejectedQuietly() {
        TokenPair first = service.issue("cust-9", "customer", null, DeviceContext.empty());
        when(authTokenRepository.findByRefreshTokenHashAndTokenFamilyAndRevokedFalse(anyString(), anyString()))
                .thenReturn(Optional.empty());

        assertThat(service.rotate(first.refreshToken(), null)).isNull();
        verify(fraudEventService, never()).record(anyString(), anyString(), any(), anyString(), anyMap());
        verify(metricsService).recordRotationRejected();
    }

    @Test
    void losingTheConsumeRaceIsNotTreatedAsReuse() {
        TokenPair first = service.issue("driver-2", "driver", null, DeviceContext.empty());
        when(authTokenRepository.findByRefreshTokenHashAndTokenFamilyAndRevokedFalse(anyString(), anyString()))
                .thenReturn(Optional.of(storedRecord(first, 1)));
        when(authTokenRepository.markConsumed(anyLong(), any(Instant.class), anyString())).thenReturn(0);

        assertThat(service.rotate(first.refreshToken(), null)).isNull();
        verify(authTokenRepository, times(1)).save(any(AuthToken.class));
        verify(authTokenRepository, never()).revokeAllActiveForUser(anyString(), any(Instant.class), anyString());
        verify(fraudEventService, never()).record(anyString(), anyString(), any(), anyString(), anyMap());
    }

    @Test
    void accessTokenIsNotAcceptedAsRefreshToken() {
        TokenPair first = service.issue("driver-3", "driver", null, DeviceContext.empty());

        assertThat(service.rotate(first.accessToken(), null)).isNull();
        verify(authTokenRepository, never()).markConsumed(anyLong(), any(Instant.class), anyString());
    }

    @Test
    void validateRequiresLiveRecord() {
        TokenPair pair = service.issue("rest-1", "restaurant", null, DeviceContext.empty());
        when(authTokenRepository.findByAccessTokenHashAndRevokedFalse(tokenHasher.hash(pair.accessToken())))
                .thenReturn(Optional.of(storedRecord(pair, 1)))
                .thenReturn(Optional.empty());

        assertThat(service.validate(pair.accessToken())).isNotNull();
        assertThat(service.validate(pair.accessToken())).isNull();
        assertThat(service.validate(pair.refreshToken())).isNull();
        assertThat(service.validate("not-a-jwt")).isNull();
    }

    @Test
    void revokeAllIsAudited() {
        when(authTokenRepository.revokeAllActiveForUser(eq("cust-1"), any(Instant.class), eq("manual"))).thenReturn(2);

        assertThat(service.revokeAll("cust-1", "manual")).isEqualTo(2);
        verify(auditEventService).recordEvent(eq("cust-1"), eq("session"), eq("REVOKE_ALL"), anyString(), any());
        verify(authTokenRepository, never()).revokeActiveInFamily(anyString(), any(Instant.class), anyString());
    }

    private static AuthToken storedRecord(TokenPair pair, int version) {
        return AuthToken.builder()
                .id(11L)
                .userId("driver-1")
                .userRole("driver")
                .tokenFamily(pair.tokenFamily())
                .tokenVersion(version)
                .deviceId("dev-1")
                .refreshExpiresAt(pair.refreshExpiresAt())
                .accessExpiresAt(pair.accessExpiresAt())
                .build();
    }
}
