package com.safego.backend.dto;

import com.safego.backend.model.AlertSeverity;
import com.safego.backend.model.AlertType;

/**
 * Result of evaluating a login. {@link Status#SKIPPED} means the detector did not run to completion
 * and says nothing about whether the login was suspicious.
 */
public record LoginRiskAssessment(Status status,
                                  AlertType alertType,
                                  AlertSeverity severity,
                                  String reason,
                                  Long alertId) {

    public enum Status {
        CLEAR,
        SUSPICIOUS,
        SKIPPED
    }

    public static LoginRiskAssessment clear() {
        return new LoginRiskAssessment(Status.CLEAR, null, null, null, null);
    }

    public static LoginRiskAssessment suspicious(AlertType alertType, AlertSeverity severity, String reason) {
        return new LoginRiskAssessment(Status.SUSPICIOUS, alertType, severity, reason, null);
    }

    public static LoginRiskAssessment skipped(String reason) {
        return new LoginRiskAssessment(Status.SKIPPED, null, null, reason, null);
    }

    public boolean isSuspicious() {
        return status == Status.SUSPICIOUS;
    }

    public LoginRiskAssessment withAlertId(Long id) {
        return new LoginRiskAssessment(status, alertType, severity, reason, id);
    }
}
