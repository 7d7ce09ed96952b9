package com.safego.backend.dto;

import com.safego.backend.model.DeviceHistory;

import java.time.Instant;

public record DeviceView(Long id,
                         String deviceId,
                         String deviceName,
                         String deviceModel,
                         String osName,
                         String osVersion,
                         String appVersion,
                         String platform,
                         String ipCountry,
                         String ipCity,
                         String lastLoginIp,
                         int loginCount,
                         int riskScore,
                         boolean trusted,
                         boolean active,
                         boolean removedByUser,
                         Instant firstSeenAt,
                         Instant lastSeenAt) {

    public static DeviceView from(DeviceHistory device) {
        return new DeviceView(device.getId(), device.getDeviceId(), device.getDeviceName(), device.getDeviceModel(),
                device.getOsName(), device.getOsVersion(), device.getAppVersion(), device.getPlatform(),
                device.getIpCountry(), device.getIpCity(), device.getLastLoginIp(), device.getLoginCount(),
                device.getRiskScore(), device.isTrusted(), device.isActive(), device.isRemovedByUser(),
                device.getFirstSeenAt(), device.getLastSeenAt());
    }
}
