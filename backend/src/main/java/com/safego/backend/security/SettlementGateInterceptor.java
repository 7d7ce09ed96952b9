package com.safego.backend.security;

import com.safego.backend.dto.SettlementRestriction;
import com.safego.backend.exception.ApiErrorWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
@RequiredArgsConstructor
public class SettlementGateInterceptor implements HandlerInterceptor {

    private final SettlementGate settlementGate;
    private final ApiErrorWriter apiErrorWriter;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        SettlementGated gated = AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getMethod(), SettlementGated.class);
        if (gated == null) {
            gated = AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), SettlementGated.class);
        }
        if (gated == null) {
            return true;
        }
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof UserPrincipal principal)) {
            return true;
        }

        SettlementRestriction restriction = settlementGate.evaluate(principal, gated.value());
        if (!restriction.restricted()) {
            return true;
        }
        apiErrorWriter.write(response, apiErrorWriter
                .builder(HttpStatus.FORBIDDEN, ApiErrorWriter.SETTLEMENT_REQUIRED, restriction.reason(), request)
                .settlementRequired(true)
                .balance(restriction.balance())
                .build());
        return false;
    }
}
