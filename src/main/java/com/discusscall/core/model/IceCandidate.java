package com.discusscall.core.model;

import lombok.Value;

@Value
public class IceCandidate {
    String candidate;
    String sdpMid;
    Integer sdpMLineIndex;
}
