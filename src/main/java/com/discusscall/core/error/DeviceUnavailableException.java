package com.discusscall.core.error;

public class DeviceUnavailableException extends CallException {

    public DeviceUnavailableException(String message, Throwable cause) {
        super(CallErrorType.DEVICE_UNAVAILABLE, message, cause);
    }
}
