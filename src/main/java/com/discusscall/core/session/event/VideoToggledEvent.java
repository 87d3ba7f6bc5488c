package com.discusscall.core.session.event;

import com.discusscall.core.model.CallSession;
import lombok.Value;

@Value
public class VideoToggledEvent {
    CallSession call;
    boolean cameraOn;
}
