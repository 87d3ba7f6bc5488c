package com.discusscall.core.feed;

import com.discusscall.core.backend.DiscussBackend;
import com.discusscall.core.config.CallProperties;
import com.discusscall.core.model.BackendNotification;
import com.discusscall.core.model.ChatMessage;
import com.discusscall.core.model.NotificationKind;
import com.discusscall.core.model.RegistryRecord;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

/**
 * 用轮询模拟 Odoo 的 bus 长连接。
 *
 * 每个订阅的会话维护两份状态：
 * - 消息水位（最后一条已推送的 mail.message id），第一次轮询只记录水位不推历史消息；
 * - 上一次看到的 rtc session 记录，和本次结果做 diff 得到 record-created / updated / removed。
 *
 * 轮询失败按 1s 起步翻倍退避，最多 30s，循环本身不会停。
 */
@Component
@Slf4j
public class OdooPollingEventFeed implements DiscussEventFeed {

    static final Duration INITIAL_BACKOFF = Duration.ofSeconds(1);
    static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private final DiscussBackend backend;
    private final CallProperties properties;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final List<DiscussEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<Long, ChannelState> channels = new ConcurrentHashMap<>();

    private volatile boolean running;
    private volatile ScheduledFuture<?> nextPoll;
    private Duration backoff = INITIAL_BACKOFF;

    public OdooPollingEventFeed(DiscussBackend backend,
                                CallProperties properties,
                                TaskScheduler scheduler,
                                Clock clock) {
        this.backend = backend;
        this.properties = properties;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        properties.getWatchedConversations().forEach(this::subscribe);
        running = true;
        schedule(properties.getFeedPollInterval());
        log.info("Event feed started, watching {} conversation(s)", channels.size());
    }

    @PreDestroy
    public void stop() {
        running = false;
        ScheduledFuture<?> f = nextPoll;
        if (f != null) {
            f.cancel(false);
        }
    }

    @Override
    public void subscribe(long conversationId) {
        if (channels.putIfAbsent(conversationId, new ChannelState()) == null) {
            log.debug("Subscribed conversation {}", conversationId);
        }
    }

    @Override
    public void unsubscribe(long conversationId) {
        channels.remove(conversationId);
    }

    @Override
    public Set<Long> subscriptions() {
        return Set.copyOf(channels.keySet());
    }

    @Override
    public void addListener(DiscussEventListener listener) {
        listeners.add(listener);
    }

    /**
     * 对所有订阅会话执行一轮轮询。任何后端错误直接抛出，由调度循环负责退避。
     */
    public void pollOnce() {
        for (var entry : channels.entrySet()) {
            pollChannel(entry.getKey(), entry.getValue());
        }
    }

    /** 当前退避时长，仅供观察 */
    Duration currentBackoff() {
        return backoff;
    }

    private void tick() {
        if (!running) return;
        Duration delay;
        try {
            pollOnce();
            backoff = INITIAL_BACKOFF;
            delay = properties.getFeedPollInterval();
        } catch (RuntimeException e) {
            delay = backoff;
            log.warn("Event feed poll failed, retrying in {}ms: {}", delay.toMillis(), e.getMessage());
            Duration doubled = backoff.multipliedBy(2);
            backoff = doubled.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : doubled;
        }
        schedule(delay);
    }

    private void schedule(Duration delay) {
        if (!running) return;
        nextPoll = scheduler.schedule(this::tick, clock.instant().plus(delay));
    }

    private void pollChannel(long conversationId, ChannelState state) {
        // ===== 新消息 =====
        if (state.messageWatermark == null) {
            state.messageWatermark = backend.latestMessageId(conversationId);
        } else {
            List<ChatMessage> messages = backend.fetchMessagesAfter(
                    conversationId, state.messageWatermark, properties.getFeedBatchSize());
            for (ChatMessage m : messages) {
                state.messageWatermark = Math.max(state.messageWatermark, m.getId());
                deliverMessage(m);
            }
        }

        // ===== rtc session diff =====
        Map<Long, RegistryRecord> current = new LinkedHashMap<>();
        for (RegistryRecord r : backend.searchRtcSessions(conversationId, null)) {
            current.put(r.getId(), r);
        }
        if (state.records == null) {
            state.records = current;
            return;
        }

        List<BackendNotification> out = new ArrayList<>();
        for (RegistryRecord r : current.values()) {
            RegistryRecord previous = state.records.get(r.getId());
            if (previous == null) {
                out.add(new BackendNotification(NotificationKind.RECORD_CREATED, toPayload(r)));
            } else if (!Objects.equals(previous.getFlags(), r.getFlags())) {
                out.add(new BackendNotification(NotificationKind.RECORD_UPDATED, toPayload(r)));
            }
        }
        for (RegistryRecord gone : state.records.values()) {
            if (!current.containsKey(gone.getId())) {
                out.add(new BackendNotification(NotificationKind.RECORD_REMOVED, toPayload(gone)));
            }
        }
        state.records = current;
        out.forEach(this::deliverNotification);
    }

    static Map<String, Object> toPayload(RegistryRecord r) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("id", r.getId());
        payload.put("channel_id", r.getConversationId());
        payload.put("channel_member_id", r.getMembershipId());
        payload.put("partner_id", r.getPartnerId());
        payload.put("caller_name", r.getPartnerName());
        if (r.getFlags() != null) {
            payload.put("is_camera_on", Boolean.TRUE.equals(r.getFlags().getCameraOn()));
            payload.put("is_muted", Boolean.TRUE.equals(r.getFlags().getMuted()));
        }
        return payload;
    }

    private void deliverMessage(ChatMessage message) {
        for (DiscussEventListener l : listeners) {
            try {
                l.onNewMessage(message);
            } catch (RuntimeException e) {
                log.error("Listener failed on message {}", message.getId(), e);
            }
        }
    }

    private void deliverNotification(BackendNotification notification) {
        for (DiscussEventListener l : listeners) {
            try {
                l.onNotification(notification);
            } catch (RuntimeException e) {
                log.error("Listener failed on notification {}", notification.getKind(), e);
            }
        }
    }

    private static class ChannelState {
        Long messageWatermark;
        Map<Long, RegistryRecord> records;
    }
}
