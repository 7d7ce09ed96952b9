package com.safego.backend.security;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a handler that a restricted driver or restaurant may not call until their balance is settled.
 * Enforced by {@link SettlementGateInterceptor}.
 */
@Documented
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface SettlementGated {

    SettlementScope value() default SettlementScope.ANY;
}
