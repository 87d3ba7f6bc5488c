package com.discusscall.core.model;

import lombok.Value;

/** SDP：type 为 offer / answer */
@Value
public class SessionDescription {
    String type;
    String sdp;

    public static SessionDescription offer(String sdp) {
        return new SessionDescription("offer", sdp);
    }

    public static SessionDescription answer(String sdp) {
        return new SessionDescription("answer", sdp);
    }

    public boolean hasVideo() {
        return sdp != null && sdp.contains("m=video");
    }
}
