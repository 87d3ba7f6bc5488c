package com.discusscall.core.strategy;

import com.discusscall.core.media.LocalMediaHandle;
import com.discusscall.core.model.CallSession;
import com.discusscall.core.rtc.NegotiatingPeer;
import com.discusscall.core.signaling.SignalingSubscription;
import lombok.extern.slf4j.Slf4j;

/**
 * 释放 CallSession 上挂着的本地资源。每一步失败都只记日志，后面的步骤照常执行。
 */
@Slf4j
public final class SessionResources {

    private SessionResources() {
    }

    public static void closeSubscription(CallSession session) {
        SignalingSubscription sub = session.getSignalingSubscription();
        if (sub == null) return;
        session.setSignalingSubscription(null);
        try {
            sub.close();
        } catch (RuntimeException e) {
            log.warn("Closing signaling subscription failed: {}", e.getMessage());
        }
    }

    public static void stopMedia(CallSession session) {
        LocalMediaHandle media = session.getLocalMedia();
        if (media == null) return;
        try {
            media.stop();
        } catch (RuntimeException e) {
            log.warn("Stopping local media failed: {}", e.getMessage());
        }
    }

    public static void closePeer(CallSession session) {
        NegotiatingPeer peer = session.getPeer();
        if (peer == null) return;
        try {
            peer.close();
        } catch (RuntimeException e) {
            log.warn("Closing peer connection failed: {}", e.getMessage());
        }
    }
}
