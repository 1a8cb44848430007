package com.iot.deviceservice.controller;

import com.iot.common.dto.device.DeviceRegistrationRequest;
import com.iot.common.dto.device.DeviceUpsertResponse;
import com.iot.common.dto.device.DeviceUsernameResponse;
import com.iot.deviceservice.service.DeviceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/devices")
@RequiredArgsConstructor
@Tag(name = "Device Service", description = "APIs for managing device-username mappings")
public class DeviceController {

    private final DeviceService deviceService;

    @PutMapping("/{deviceId}")
    @Operation(summary = "Register a device", description = "Create or update the username of a device")
    public ResponseEntity<DeviceUpsertResponse> upsertDevice(
            @PathVariable String deviceId,
            @Valid @RequestBody DeviceRegistrationRequest request) {
        return ResponseEntity.ok(deviceService.upsertDevice(deviceId, request));
    }

    @GetMapping("/{deviceId}/username")
    @Operation(summary = "Get device username", description = "Retrieve the username associated with a device")
    public ResponseEntity<DeviceUsernameResponse> getDeviceUsername(@PathVariable String deviceId) {
        return ResponseEntity.ok(deviceService.getUsername(deviceId));
    }
}
