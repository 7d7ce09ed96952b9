package com.safego.backend.security;

/**
 * Which actors a settlement gate applies to.
 */
public enum SettlementScope {
    /** Everyone except admins and customers. */
    ANY,
    /** Drivers only. Other roles pass. */
    DRIVER,
    /** Restaurants only. Other roles pass. */
    RESTAURANT
}
