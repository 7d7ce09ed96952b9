package com.safego.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A successful login as seen by the suspicious login detector.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginContext {

    private String userId;
    private String userRole;
    private String identifier;
    private String email;
    private String phone;
    private DeviceContext device;
}
