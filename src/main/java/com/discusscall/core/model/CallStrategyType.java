package com.discusscall.core.model;

/**
 * 三种通话实现档位，tag 会写进 callId，方便从 id 看出是哪个策略产生的。
 */
public enum CallStrategyType {
    FULL_MEDIA("webrtc"),
    SIGNALING_ONLY("signaling"),
    MINIMAL("minimal");

    private final String tag;

    CallStrategyType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
