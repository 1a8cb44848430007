package com.iot.deviceservice.exception;

public class DeviceNotFoundException extends RuntimeException {

    public DeviceNotFoundException(String deviceId) {
        super("Device " + deviceId + " not found");
    }
}
