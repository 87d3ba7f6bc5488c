package com.discusscall.core.model;

/**
 * 信令信封类型，wireType / subject 与 Web 端保持一致。
 */
public enum EnvelopeKind {
    OFFER("webrtc-sdp-offer", "WebRTC SDP Offer"),
    ANSWER("webrtc-sdp-answer", "WebRTC SDP Answer"),
    ICE_CANDIDATE("webrtc-ice-candidate", "WebRTC ICE Candidate");

    private final String wireType;
    private final String subject;

    EnvelopeKind(String wireType, String subject) {
        this.wireType = wireType;
        this.subject = subject;
    }

    public String wireType() {
        return wireType;
    }

    public String subject() {
        return subject;
    }

    /** 未知类型返回 null，调用方自行忽略 */
    public static EnvelopeKind fromWireType(String type) {
        if (type == null) return null;
        for (EnvelopeKind k : values()) {
            if (k.wireType.equals(type)) {
                return k;
            }
        }
        return null;
    }
}
