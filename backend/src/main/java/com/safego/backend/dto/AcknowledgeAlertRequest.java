package com.safego.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AcknowledgeAlertRequest {

    /**
     * False when the user does not recognise the login. All of their sessions are then revoked.
     */
    private Boolean wasLegitimate = Boolean.TRUE;
}
