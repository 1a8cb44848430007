package com.iot.deviceservice.service;

import com.iot.common.dto.device.DeviceRegistrationRequest;
import com.iot.common.dto.device.DeviceUpsertResponse;
import com.iot.common.dto.device.DeviceUsernameResponse;
import com.iot.deviceservice.exception.DeviceNotFoundException;
import com.iot.deviceservice.exception.InvalidDeviceRequestException;
import com.iot.deviceservice.model.Device;
import com.iot.deviceservice.repository.DeviceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class DeviceService {

    private final DeviceRepository deviceRepository;

    /**
     * Create or update the username of a device. Repeating the same request
     * leaves the stored mapping unchanged.
     */
    @Transactional
    public DeviceUpsertResponse upsertDevice(String deviceId, DeviceRegistrationRequest request) {
        if (request.deviceId() != null && !request.deviceId().equals(deviceId)) {
            throw new InvalidDeviceRequestException(
                    "Body deviceId " + request.deviceId() + " does not match path " + deviceId);
        }

        Device device = deviceRepository.findById(deviceId)
                .map(existing -> {
                    existing.setUsername(request.username());
                    log.info("Updated device {} with username {}", deviceId, request.username());
                    return existing;
                })
                .orElseGet(() -> {
                    log.info("Created new device {} with username {}", deviceId, request.username());
                    return Device.builder()
                            .deviceId(deviceId)
                            .username(request.username())
                            .build();
                });

        deviceRepository.save(device);
        return DeviceUpsertResponse.updated(deviceId);
    }

    @Transactional(readOnly = true)
    public DeviceUsernameResponse getUsername(String deviceId) {
        log.debug("Fetching username for device: {}", deviceId);
        return deviceRepository.findById(deviceId)
                .map(device -> new DeviceUsernameResponse(device.getUsername()))
                .orElseThrow(() -> new DeviceNotFoundException(deviceId));
    }
}
