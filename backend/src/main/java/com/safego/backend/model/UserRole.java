package com.safego.backend.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Roles carried in issued tokens. The wire form is the lower-case name.
 */
public enum UserRole {
    CUSTOMER(null),
    DRIVER(OwnerType.DRIVER),
    RESTAURANT(OwnerType.RESTAURANT),
    ADMIN(null);

    private final OwnerType settlementOwner;

    UserRole(OwnerType settlementOwner) {
        this.settlementOwner = settlementOwner;
    }

    /**
     * Balance ledger the role settles against, empty for roles exempt from settlement.
     */
    public Optional<OwnerType> settlementOwner() {
        return Optional.ofNullable(settlementOwner);
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<UserRole> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (UserRole role : values()) {
            if (role.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
