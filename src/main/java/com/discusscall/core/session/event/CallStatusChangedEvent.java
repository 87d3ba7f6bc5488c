package com.discusscall.core.session.event;

import com.discusscall.core.model.CallSession;
import com.discusscall.core.model.CallStatus;
import lombok.Value;

/** 每次状态迁移都会发，call 为迁移后的快照 */
@Value
public class CallStatusChangedEvent {
    CallSession call;
    CallStatus previous;
    CallStatus current;
}
