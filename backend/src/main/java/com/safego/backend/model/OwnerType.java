package com.safego.backend.model;

import java.util.Optional;

public enum OwnerType {
    DRIVER,
    RESTAURANT;

    public static Optional<OwnerType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (OwnerType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
