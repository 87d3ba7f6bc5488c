package com.discusscall.core.model;

import com.discusscall.core.media.LocalMediaHandle;
import com.discusscall.core.rtc.NegotiatingPeer;
import com.discusscall.core.rtc.RemoteMediaHandle;
import com.discusscall.core.signaling.SignalingSubscription;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 一通进行中（或刚结束）的通话。
 *
 * 约定：
 * - 同一进程同一时刻最多一个活跃 CallSession，由 CallSessionManager 持有；
 * - 没有 registryId 的会话只允许出现在 MINIMAL 策略下；
 * - duration 只在进入终态时计算一次。
 */
@Data
public class CallSession {

    /** strategy tag + registry id + 时间戳，见 CallIdFormat */
    private String callId;

    private long conversationId;
    private String conversationName;
    private List<CallParticipant> participants = new CopyOnWriteArrayList<>();
    private MediaKind mediaKind = MediaKind.AUDIO;
    private CallStatus status = CallStatus.IDLE;
    private CallStrategyType strategy;

    private Instant startedAt;
    private Instant endedAt;
    private Duration duration;

    /** 本端创建的 registry 记录 */
    private Long registryId;

    /** 清理 registry 记录时要用的 membership */
    private Long membershipId;

    /** 接听时对端的 registry 记录，对端记录被删除同样意味着通话结束 */
    private Long peerRegistryId;

    private boolean muted;
    private boolean cameraOn;

    @JsonIgnore
    @ToString.Exclude
    private LocalMediaHandle localMedia;

    @JsonIgnore
    @ToString.Exclude
    private NegotiatingPeer peer;

    @JsonIgnore
    @ToString.Exclude
    private RemoteMediaHandle remoteMedia;

    @JsonIgnore
    @ToString.Exclude
    private SignalingSubscription signalingSubscription;

    public static CallSession connecting(long conversationId, String conversationName,
                                         MediaKind mediaKind, Instant now) {
        CallSession s = new CallSession();
        s.setConversationId(conversationId);
        s.setConversationName(conversationName);
        s.setMediaKind(mediaKind);
        s.setCameraOn(mediaKind.isVideo());
        s.setStatus(CallStatus.CONNECTING);
        s.setStartedAt(now);
        return s;
    }

    /**
     * 进入终态。重复调用不会覆盖已经记录的结束时间和时长。
     */
    public void finish(CallStatus terminal, Instant now) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("not a terminal status: " + terminal);
        }
        if (duration == null) {
            endedAt = now;
            duration = startedAt == null ? Duration.ZERO : Duration.between(startedAt, now);
            status = terminal;
        }
    }

    public boolean isOwnRecord(Long recordId) {
        return recordId != null && recordId.equals(registryId);
    }

    /** 本端记录或对端记录 */
    public boolean isTrackedRecord(Long recordId) {
        return recordId != null && (recordId.equals(registryId) || recordId.equals(peerRegistryId));
    }

    public boolean hasParticipant(long partnerId) {
        return participants.stream().anyMatch(p -> p.getId() == partnerId);
    }

    /**
     * 给观察者用的快照：参与者列表复制一份，媒体句柄仍指向同一个对象。
     */
    public CallSession snapshot() {
        CallSession copy = new CallSession();
        copy.setCallId(callId);
        copy.setConversationId(conversationId);
        copy.setConversationName(conversationName);
        List<CallParticipant> ps = new CopyOnWriteArrayList<>();
        for (CallParticipant p : participants) {
            ps.add(new CallParticipant(p.getId(), p.getName(), p.getAvatar()));
        }
        copy.setParticipants(ps);
        copy.setMediaKind(mediaKind);
        copy.setStatus(status);
        copy.setStrategy(strategy);
        copy.setStartedAt(startedAt);
        copy.setEndedAt(endedAt);
        copy.setDuration(duration);
        copy.setRegistryId(registryId);
        copy.setMembershipId(membershipId);
        copy.setPeerRegistryId(peerRegistryId);
        copy.setMuted(muted);
        copy.setCameraOn(cameraOn);
        copy.setLocalMedia(localMedia);
        copy.setPeer(peer);
        copy.setRemoteMedia(remoteMedia);
        return copy;
    }
}
