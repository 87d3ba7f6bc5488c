package com.discusscall.core.error;

public enum CallErrorType {
    PERMISSION_DENIED,
    DEVICE_UNAVAILABLE,
    NO_MEMBERSHIP,
    SIGNALING_FAILURE,
    REGISTRY_FAILURE,
    STRATEGY_UNAVAILABLE,
    CANCELLED
}
