package com.discusscall.core.session.event;

import com.discusscall.core.model.CallInvitation;
import lombok.Value;

@Value
public class IncomingCallEvent {
    CallInvitation invitation;
}
