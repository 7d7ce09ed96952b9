package com.safego.backend.model;

import java.util.Locale;

/**
 * Suspicious login classifications, declared in evaluation priority order.
 */
public enum AlertType {
    NEW_DEVICE,
    NEW_COUNTRY,
    RAPID_IP_CHANGE,
    HIGH_RISK_LOCATION;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
