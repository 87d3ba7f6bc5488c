package com.discusscall.core.notify;

import com.discusscall.core.backend.DiscussMessages;
import com.discusscall.core.backend.LocalIdentityProvider;
import com.discusscall.core.config.CallProperties;
import com.discusscall.core.model.BackendNotification;
import com.discusscall.core.model.CallInvitation;
import com.discusscall.core.model.CallSession;
import com.discusscall.core.model.ChatMessage;
import com.discusscall.core.model.InvitationSource;
import com.discusscall.core.model.LocalIdentity;
import com.discusscall.core.model.MediaKind;
import com.discusscall.core.session.CallEventPublisher;
import com.discusscall.core.session.event.CallAnsweredEvent;
import com.discusscall.core.session.event.CallEndedEvent;
import com.discusscall.core.session.event.CallStartedEvent;
import com.discusscall.core.session.event.CallStatusChangedEvent;
import com.discusscall.core.session.event.IncomingCallEvent;
import com.discusscall.core.session.event.InvitationDeclinedEvent;
import com.discusscall.core.session.event.InvitationExpiredEvent;
import com.discusscall.core.strategy.CallIdFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * 把三种来源归一成 CallInvitation 并发出 incomingCall：
 * 1. 显式的 call-invitation 通知；
 * 2. registry 的 record-created；
 * 3. 普通会话消息里的“发起了通话”提示（启发式）。
 *
 * 发出前过滤：自己发起的、当前通话自己的记录/会话、已经在响铃的重复来电。
 * 每条来电都有响铃超时，到时按拒接处理。
 */
@Service
@Slf4j
public class InvitationDispatcher {

    static final String UNKNOWN_CALLER = "Unknown Caller";

    private final LocalIdentityProvider identityProvider;
    private final CallEventPublisher events;
    private final TaskScheduler scheduler;
    private final CallProperties properties;
    private final Clock clock;

    private final Map<String, Pending> pending = new LinkedHashMap<>();

    private volatile Long activeConversationId;
    private volatile Long activeRegistryId;
    private volatile Long activePeerRegistryId;

    public InvitationDispatcher(LocalIdentityProvider identityProvider,
                                CallEventPublisher events,
                                TaskScheduler scheduler,
                                CallProperties properties,
                                Clock clock) {
        this.identityProvider = identityProvider;
        this.events = events;
        this.scheduler = scheduler;
        this.properties = properties;
        this.clock = clock;
    }

    // ===================== 三种来源 =====================

    /**
     * 显式邀请：call_id / caller_id / caller_name / call_type / session_id / channel_id
     */
    public Optional<CallInvitation> fromExplicit(BackendNotification n) {
        Long channelId = n.getLong("channel_id");
        if (channelId == null) {
            log.debug("Explicit invitation without channel_id ignored: {}", n.getPayload());
            return Optional.empty();
        }
        Long registryId = n.getLong("session_id");
        MediaKind kind = MediaKind.fromVideoFlag("video".equals(n.getString("call_type")));
        String callId = n.getString("call_id");
        if (callId == null) {
            callId = registryId != null
                    ? CallIdFormat.registryInvitation(registryId)
                    : CallIdFormat.chatInvitation(kind, channelId, clock.instant());
        }
        Long callerId = n.getLong("caller_id");
        return dispatch(CallInvitation.builder()
                .callId(callId)
                .channelId(channelId)
                .fromUserId(callerId == null ? 0L : callerId)
                .fromUserName(nameOr(n.getString("caller_name")))
                .mediaKind(kind)
                .receivedAt(clock.instant())
                .registryId(registryId)
                .source(InvitationSource.EXPLICIT)
                .build());
    }

    /**
     * registry 记录创建：{id, channel_id, partner_id, caller_name, is_camera_on}
     */
    public Optional<CallInvitation> fromRegistryRecord(BackendNotification n) {
        Long id = n.getLong("id");
        Long channelId = n.getLong("channel_id");
        if (id == null || channelId == null) {
            log.debug("Registry record event without id/channel ignored: {}", n.getPayload());
            return Optional.empty();
        }
        Long partnerId = n.getLong("partner_id");
        return dispatch(CallInvitation.builder()
                .callId(CallIdFormat.registryInvitation(id))
                .channelId(channelId)
                .fromUserId(partnerId == null ? 0L : partnerId)
                .fromUserName(nameOr(n.getString("caller_name")))
                .mediaKind(MediaKind.fromVideoFlag(n.getBoolean("is_camera_on")))
                .receivedAt(clock.instant())
                .registryId(id)
                .source(InvitationSource.REGISTRY_RECORD)
                .build());
    }

    /**
     * 会话消息启发式。作者字段格式不对时 fromUserId 记 0、名字记 Unknown Caller，不抛异常。
     */
    public Optional<CallInvitation> fromChatMessage(ChatMessage message) {
        MediaKind kind = CallMessageDetector.mediaKind(message.getBody());
        if (kind == null) {
            return Optional.empty();
        }
        Long authorId = DiscussMessages.authorId(message.getAuthor());
        Instant now = clock.instant();
        return dispatch(CallInvitation.builder()
                .callId(CallIdFormat.chatInvitation(kind, message.getConversationId(), now))
                .channelId(message.getConversationId())
                .fromUserId(authorId == null ? 0L : authorId)
                .fromUserName(nameOr(DiscussMessages.displayName(message.getEmailFrom())))
                .mediaKind(kind)
                .receivedAt(now)
                .source(InvitationSource.CHAT_MESSAGE)
                .build());
    }

    // ===================== 对 UI =====================

    public boolean declineInvitation(String callId) {
        Pending p = remove(callId);
        if (p == null) {
            return false;
        }
        log.info("Invitation {} declined", callId);
        events.publish(new InvitationDeclinedEvent(p.invitation));
        return true;
    }

    public Optional<CallInvitation> findPending(String callId) {
        synchronized (pending) {
            Pending p = pending.get(callId);
            return p == null ? Optional.empty() : Optional.of(p.invitation);
        }
    }

    public List<CallInvitation> getPendingInvitations() {
        synchronized (pending) {
            List<CallInvitation> list = new ArrayList<>();
            pending.values().forEach(p -> list.add(p.invitation));
            return list;
        }
    }

    /** 主叫在接听前撤掉了记录 */
    public void onRecordRemoved(long recordId) {
        List<String> ids;
        synchronized (pending) {
            ids = pending.values().stream()
                    .filter(p -> Objects.equals(p.invitation.getRegistryId(), recordId))
                    .map(p -> p.invitation.getCallId())
                    .toList();
        }
        ids.forEach(id -> expire(id, "caller withdrew"));
    }

    // ===================== 当前通话跟踪 =====================

    @EventListener
    public void onCallStatusChanged(CallStatusChangedEvent e) {
        if (e.getCurrent().isLive()) {
            track(e.getCall());
        }
    }

    @EventListener
    public void onCallStarted(CallStartedEvent e) {
        track(e.getCall());
    }

    @EventListener
    public void onCallAnswered(CallAnsweredEvent e) {
        track(e.getCall());
        if (remove(e.getInvitation().getCallId()) != null) {
            log.debug("Invitation {} accepted", e.getInvitation().getCallId());
        }
    }

    @EventListener
    public void onCallEnded(CallEndedEvent e) {
        CallSession call = e.getCall();
        if (Objects.equals(activeConversationId, call.getConversationId())) {
            activeConversationId = null;
            activeRegistryId = null;
            activePeerRegistryId = null;
        }
        if (call.getPeerRegistryId() != null) {
            onRecordRemoved(call.getPeerRegistryId());
        }
    }

    // ===================== 内部 =====================

    Optional<CallInvitation> dispatch(CallInvitation invitation) {
        Long self = identityProvider.tryGet().map(LocalIdentity::getPartnerId).orElse(null);
        if (self == null) {
            log.warn("Cannot filter self-originated invitations, dropping {}", invitation.getCallId());
            return Optional.empty();
        }
        if (invitation.getFromUserId() == self) {
            log.debug("Self-originated invitation {} ignored", invitation.getCallId());
            return Optional.empty();
        }
        Long record = invitation.getRegistryId();
        if (record != null && (record.equals(activeRegistryId) || record.equals(activePeerRegistryId))) {
            log.debug("Invitation {} belongs to the active call", invitation.getCallId());
            return Optional.empty();
        }
        if (Objects.equals(activeConversationId, invitation.getChannelId())) {
            log.debug("Invitation {} in the active call's conversation ignored", invitation.getCallId());
            return Optional.empty();
        }

        synchronized (pending) {
            if (pending.containsKey(invitation.getCallId()) || isDuplicate(invitation)) {
                log.debug("Duplicate invitation {} ignored", invitation.getCallId());
                return Optional.empty();
            }
            Pending p = new Pending(invitation);
            pending.put(invitation.getCallId(), p);
            p.timer = scheduler.schedule(() -> expire(invitation.getCallId(), "ring timeout"),
                    clock.instant().plus(properties.getRingTimeout()));
        }

        log.info("Incoming {} call {} from {} ({}) via {}", invitation.getMediaKind().label(),
                invitation.getCallId(), invitation.getFromUserName(), invitation.getFromUserId(),
                invitation.getSource());
        events.publish(new IncomingCallEvent(invitation));
        return Optional.of(invitation);
    }

    void expire(String callId, String reason) {
        Pending p = remove(callId);
        if (p == null) return;
        log.info("Invitation {} expired: {}", callId, reason);
        events.publish(new InvitationExpiredEvent(p.invitation));
    }

    /** 同一会话同一主叫已经在响铃（例如记录事件和提示消息先后到达） */
    private boolean isDuplicate(CallInvitation invitation) {
        return invitation.getFromUserId() != 0 && pending.values().stream()
                .map(p -> p.invitation)
                .anyMatch(i -> i.getChannelId() == invitation.getChannelId()
                        && i.getFromUserId() == invitation.getFromUserId());
    }

    private Pending remove(String callId) {
        Pending p;
        synchronized (pending) {
            p = pending.remove(callId);
        }
        if (p != null && p.timer != null) {
            p.timer.cancel(false);
        }
        return p;
    }

    private void track(CallSession call) {
        activeConversationId = call.getConversationId();
        activeRegistryId = call.getRegistryId();
        activePeerRegistryId = call.getPeerRegistryId();
    }

    private static String nameOr(String name) {
        return name == null || name.isBlank() ? UNKNOWN_CALLER : name;
    }

    private static class Pending {
        final CallInvitation invitation;
        ScheduledFuture<?> timer;

        Pending(CallInvitation invitation) {
            this.invitation = invitation;
        }
    }
}
