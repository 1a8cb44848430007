package com.iot.deviceservice.exception;

/**
 * The request is well-formed JSON but contradicts the addressed device.
 */
public class InvalidDeviceRequestException extends RuntimeException {

    public InvalidDeviceRequestException(String message) {
        super(message);
    }
}
