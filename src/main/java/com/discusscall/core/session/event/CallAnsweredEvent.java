package com.discusscall.core.session.event;

import com.discusscall.core.model.CallSession;
import com.discusscall.core.model.CallInvitation;
import lombok.Value;

/** 接听成功，invitation 是被接听的那条来电 */
@Value
public class CallAnsweredEvent {
    CallSession call;
    CallInvitation invitation;
}
