package com.safego.backend.dto;

public record LoginResult(String userId, String role, TokenPair tokens, LoginRiskAssessment riskAssessment) {
}
