package com.discusscall.core.registry;

import com.discusscall.core.backend.LocalIdentityProvider;
import com.discusscall.core.config.CallProperties;
import com.discusscall.core.error.CallException;
import com.discusscall.core.model.LocalIdentity;
import com.discusscall.core.model.RegistryRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

/**
 * 通话期间定时检查 registry：
 * - 本端或对端记录消失 -> 远端挂断；
 * - 会话里出现其他成员的新记录 -> 有人加入。
 *
 * 每通电话一个 Watch，拆除通话时必须 cancel，避免旧 callId 的轮询影响新通话。
 */
@Component
@Slf4j
public class RegistryWatcher {

    private final SessionRegistryClient registry;
    private final LocalIdentityProvider identityProvider;
    private final CallProperties properties;
    private final TaskScheduler scheduler;
    private final Clock clock;

    public RegistryWatcher(SessionRegistryClient registry,
                           LocalIdentityProvider identityProvider,
                           CallProperties properties,
                           TaskScheduler scheduler,
                           Clock clock) {
        this.registry = registry;
        this.identityProvider = identityProvider;
        this.properties = properties;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public Watch watch(long conversationId, Long ownRecordId, Long peerRecordId, RegistryWatchListener listener) {
        Watch w = new Watch(conversationId, ownRecordId, peerRecordId, listener);
        w.future = scheduler.scheduleWithFixedDelay(w::poll,
                clock.instant().plus(properties.getRegistryPollInterval()),
                properties.getRegistryPollInterval());
        log.debug("Watching registry: conversation={}, own={}, peer={}", conversationId, ownRecordId, peerRecordId);
        return w;
    }

    public class Watch {
        private final long conversationId;
        private final Long ownRecordId;
        private final Long peerRecordId;
        private final RegistryWatchListener listener;
        private final Set<Long> seen = new HashSet<>();
        private volatile boolean cancelled;
        private volatile ScheduledFuture<?> future;

        Watch(long conversationId, Long ownRecordId, Long peerRecordId, RegistryWatchListener listener) {
            this.conversationId = conversationId;
            this.ownRecordId = ownRecordId;
            this.peerRecordId = peerRecordId;
            this.listener = listener;
            if (peerRecordId != null) {
                seen.add(peerRecordId);
            }
        }

        /** 执行一次检查，调度线程和测试都会直接调用 */
        public synchronized void poll() {
            if (cancelled) return;
            try {
                if (ownRecordId != null && registry.findRecord(ownRecordId).isEmpty()) {
                    log.info("Own registry record {} disappeared", ownRecordId);
                    cancel();
                    listener.onRegistryRemoved(ownRecordId);
                    return;
                }
                if (peerRecordId != null && registry.findRecord(peerRecordId).isEmpty()) {
                    log.info("Peer registry record {} disappeared", peerRecordId);
                    cancel();
                    listener.onRegistryRemoved(peerRecordId);
                    return;
                }
                Long self = identityProvider.tryGet().map(LocalIdentity::getPartnerId).orElse(null);
                for (RegistryRecord r : registry.listRecords(conversationId)) {
                    boolean own = r.getId() == (ownRecordId == null ? -1L : ownRecordId)
                            || (self != null && r.getPartnerId() == self);
                    if (!own && seen.add(r.getId())) {
                        listener.onParticipantJoined(r);
                    }
                }
            } catch (CallException e) {
                log.warn("Registry poll for conversation {} failed: {}", conversationId, e.getMessage());
            }
        }

        public void cancel() {
            cancelled = true;
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }

        public boolean isCancelled() {
            return cancelled;
        }
    }
}
