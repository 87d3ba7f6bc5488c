package com.discusscall.core.session.event;

import com.discusscall.core.model.CallSession;
import com.discusscall.core.model.CallParticipant;
import lombok.Value;

@Value
public class ParticipantJoinedEvent {
    CallSession call;
    CallParticipant participant;
}
