package com.discusscall.core.session.event;

import com.discusscall.core.model.CallInvitation;
import lombok.Value;

/** 来电响铃超时或主叫已挂断 */
@Value
public class InvitationExpiredEvent {
    CallInvitation invitation;
}
