package com.discusscall.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 归一化后的“有人呼叫你”事件。只给 UI 消费一次，不落库。
 */
@Value
@Builder(toBuilder = true)
public class CallInvitation {
    String callId;
    long channelId;
    long fromUserId;
    String fromUserName;
    MediaKind mediaKind;
    Instant receivedAt;

    /** 对端的 registry 记录 id，可选 */
    Long registryId;

    InvitationSource source;

    public boolean isVideo() {
        return mediaKind != null && mediaKind.isVideo();
    }
}
