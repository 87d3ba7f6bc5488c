package com.discusscall.core.session.event;

import com.discusscall.core.model.CallSession;
import lombok.Value;

/** 通话拆除完成，快照里带着结束时间和时长 */
@Value
public class CallEndedEvent {
    CallSession call;
}
