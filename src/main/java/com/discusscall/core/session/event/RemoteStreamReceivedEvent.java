package com.discusscall.core.session.event;

import com.discusscall.core.model.CallSession;
import com.discusscall.core.rtc.RemoteMediaHandle;
import lombok.Value;

@Value
public class RemoteStreamReceivedEvent {
    CallSession call;
    RemoteMediaHandle stream;
}
