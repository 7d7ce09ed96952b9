package com.safego.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Device and network details the client reports, plus the address the request came from.
 * Every field is optional.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DeviceContext {

    private String deviceId;
    private String deviceFingerprint;
    private String deviceName;
    private String deviceModel;
    private String osName;
    private String osVersion;
    private String appVersion;
    private String platform;
    private String ipAddress;
    private String country;
    private String city;
    private String userAgent;

    public static DeviceContext empty() {
        return new DeviceContext();
    }
}
