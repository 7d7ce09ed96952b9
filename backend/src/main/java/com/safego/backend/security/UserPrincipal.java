package com.safego.backend.security;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserPrincipal {
    private String userId;
    private String email;
    private String role;
    private String tokenFamily;

    public static UserPrincipal from(AccessTokenClaims claims) {
        return new UserPrincipal(claims.userId(), claims.email(), claims.userRole(), claims.tokenFamily());
    }
}
