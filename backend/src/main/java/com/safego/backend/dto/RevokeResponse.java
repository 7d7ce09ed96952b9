package com.safego.backend.dto;

public record RevokeResponse(int revoked) {
}
