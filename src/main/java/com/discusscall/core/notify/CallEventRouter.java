package com.discusscall.core.notify;

import com.discusscall.core.feed.DiscussEventFeed;
import com.discusscall.core.feed.DiscussEventListener;
import com.discusscall.core.model.BackendNotification;
import com.discusscall.core.model.ChatMessage;
import com.discusscall.core.model.RegistryRecord;
import com.discusscall.core.model.SessionFlags;
import com.discusscall.core.session.CallSessionManager;
import com.discusscall.core.signaling.SignalingTransport;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 事件通道到通话核心的唯一入口。
 * 新消息先交给信令传输，不是信封的再走来电启发式；record-* 通知同时送给状态机和来电分发。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CallEventRouter implements DiscussEventListener {

    private final DiscussEventFeed feed;
    private final InvitationDispatcher dispatcher;
    private final CallSessionManager manager;
    private final SignalingTransport transport;

    @PostConstruct
    public void register() {
        feed.addListener(this);
    }

    @Override
    public void onNotification(BackendNotification n) {
        switch (n.getKind()) {
            case CALL_INVITATION -> dispatcher.fromExplicit(n);
            case RECORD_CREATED -> {
                RegistryRecord record = toRecord(n);
                if (record != null) {
                    manager.onParticipantJoined(record);
                }
                dispatcher.fromRegistryRecord(n);
            }
            case RECORD_JOINED -> {
                RegistryRecord record = toRecord(n);
                if (record != null) {
                    manager.onParticipantJoined(record);
                }
            }
            case RECORD_REMOVED -> {
                Long id = n.getLong("id");
                if (id != null) {
                    manager.onRegistryRemoved(id);
                    dispatcher.onRecordRemoved(id);
                }
            }
            case RECORD_UPDATED, OTHER -> log.trace("Notification {} not routed", n.getKind());
        }
    }

    @Override
    public void onNewMessage(ChatMessage message) {
        if (transport.handleIncomingMessage(message)) {
            return;
        }
        dispatcher.fromChatMessage(message);
    }

    static RegistryRecord toRecord(BackendNotification n) {
        Long id = n.getLong("id");
        Long channelId = n.getLong("channel_id");
        Long partnerId = n.getLong("partner_id");
        if (id == null || channelId == null || partnerId == null) {
            return null;
        }
        Long memberId = n.getLong("channel_member_id");
        return RegistryRecord.builder()
                .id(id)
                .conversationId(channelId)
                .membershipId(memberId == null ? 0L : memberId)
                .partnerId(partnerId)
                .partnerName(n.getString("caller_name"))
                .flags(SessionFlags.builder()
                        .cameraOn(n.getBoolean("is_camera_on"))
                        .muted(n.getBoolean("is_muted"))
                        .build())
                .build();
    }
}
