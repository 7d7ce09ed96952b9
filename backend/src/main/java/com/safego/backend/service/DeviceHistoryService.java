package com.safego.backend.service;

import com.safego.backend.dto.DeviceContext;
import com.safego.backend.dto.DeviceView;
import com.safego.backend.exception.NotFoundException;
import com.safego.backend.model.DeviceHistory;
import com.safego.backend.repository.DeviceHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Devices a user has logged in from. A device removed by its user stays removed on later logins
 * and is treated as unknown by the suspicious login detector.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceHistoryService {

    private final DeviceHistoryRepository deviceHistoryRepository;
    private final AuditEventService auditEventService;
    private final Clock clock;

    /**
     * Upserts the device row for a successful login. Returns {@code null} when no device id was supplied.
     */
    public DeviceHistory recordDevice(String userId, String userRole, DeviceContext device) {
        if (device == null || device.getDeviceId() == null || device.getDeviceId().isBlank()) {
            return null;
        }
        return deviceHistoryRepository.findByUserIdAndDeviceId(userId, device.getDeviceId())
                .map(existing -> touch(existing, device))
                .orElseGet(() -> create(userId, userRole, device));
    }

    @Transactional(readOnly = true)
    public List<DeviceHistory> recentActiveDevices(String userId, int limit) {
        return deviceHistoryRepository.findByUserIdAndActiveTrueAndRemovedByUserFalseOrderByLastSeenAtDesc(
                userId, PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional(readOnly = true)
    public List<DeviceView> listDevices(String userId, boolean includeRemoved) {
        List<DeviceHistory> devices = includeRemoved
                ? deviceHistoryRepository.findByUserIdOrderByLastSeenAtDesc(userId)
                : deviceHistoryRepository.findByUserIdAndRemovedByUserFalseOrderByLastSeenAtDesc(userId);
        return devices.stream().map(DeviceView::from).collect(Collectors.toList());
    }

    @Transactional
    public DeviceView trustDevice(String userId, String deviceId) {
        DeviceHistory device = require(userId, deviceId);
        device.setTrusted(true);
        auditEventService.recordEvent(userId, "device", "DEVICE_TRUSTED", "Device marked as trusted",
                Map.of("deviceId", deviceId));
        return DeviceView.from(deviceHistoryRepository.save(device));
    }

    @Transactional
    public DeviceView removeDevice(String userId, String deviceId) {
        DeviceHistory device = require(userId, deviceId);
        device.setActive(false);
        device.setRemovedByUser(true);
        device.setRemovedAt(clock.instant());
        auditEventService.recordEvent(userId, "device", "DEVICE_REMOVED", "Device removed by user",
                Map.of("deviceId", deviceId));
        return DeviceView.from(deviceHistoryRepository.save(device));
    }

    private DeviceHistory require(String userId, String deviceId) {
        return deviceHistoryRepository.findByUserIdAndDeviceId(userId, deviceId)
                .orElseThrow(() -> new NotFoundException("Device not found"));
    }

    private DeviceHistory touch(DeviceHistory existing, DeviceContext device) {
        existing.setLastSeenAt(clock.instant());
        existing.setLoginCount(existing.getLoginCount() + 1);
        existing.setLastLoginIp(orElse(device.getIpAddress(), existing.getLastLoginIp()));
        existing.setIpCountry(orElse(device.getCountry(), existing.getIpCountry()));
        existing.setIpCity(orElse(device.getCity(), existing.getIpCity()));
        existing.setAppVersion(orElse(device.getAppVersion(), existing.getAppVersion()));
        return deviceHistoryRepository.save(existing);
    }

    private DeviceHistory create(String userId, String userRole, DeviceContext device) {
        Instant now = clock.instant();
        DeviceHistory created = DeviceHistory.builder()
                .userId(userId)
                .userRole(userRole)
                .deviceId(device.getDeviceId())
                .deviceName(device.getDeviceName())
                .deviceModel(device.getDeviceModel())
                .osName(device.getOsName())
                .osVersion(device.getOsVersion())
                .appVersion(device.getAppVersion())
                .platform(device.getPlatform())
                .ipAddress(device.getIpAddress())
                .ipCountry(device.getCountry())
                .ipCity(device.getCity())
                .lastLoginIp(device.getIpAddress())
                .loginCount(1)
                .active(true)
                .firstSeenAt(now)
                .lastSeenAt(now)
                .build();
        try {
            return deviceHistoryRepository.saveAndFlush(created);
        } catch (DataIntegrityViolationException ex) {
            log.debug("Device row created concurrently: userId={}, deviceId={}", userId, device.getDeviceId());
            return touch(require(userId, device.getDeviceId()), device);
        }
    }

    private static String orElse(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
