package com.discusscall.core.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CallServiceStatus {
    boolean initialized;
    boolean activeCall;
    CallStatus status;
    boolean mediaPermission;
    CallStrategyType strategy;
    boolean muted;
    boolean cameraOn;
}
