package com.discusscall.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * 通过会话消息通道传输的信令单元（仅 full-media 策略使用）。
 * 至少一次投递，相互之间可能乱序。
 */
@Value
@Builder
public class SignalingEnvelope {
    EnvelopeKind kind;
    long conversationId;

    /** 关联的 registry 记录 id，ICE 信封可能没有 */
    Long registryId;

    /** OFFER / ANSWER 时有值 */
    SessionDescription description;

    /** ICE_CANDIDATE 时有值 */
    IceCandidate candidate;

    /** 发送时间，毫秒 */
    long sentAt;

    /** 发送方 partner id，解析不到时为 null */
    Long senderId;
}
