package com.safego.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class TokenRetentionSweeper {

    private final SessionTokenService sessionTokenService;

    @Scheduled(fixedDelayString = "${safego.jwt.retention-sweep-interval-ms:3600000}",
            initialDelayString = "${safego.jwt.retention-sweep-interval-ms:3600000}")
    public void sweepExpiredTokens() {
        try {
            sessionTokenService.cleanupExpired();
        } catch (RuntimeException e) {
            log.error("Token retention sweep failed", e);
        }
    }
}
