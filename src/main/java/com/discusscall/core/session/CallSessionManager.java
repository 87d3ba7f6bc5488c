package com.discusscall.core.session;

import com.discusscall.core.backend.LocalIdentityProvider;
import com.discusscall.core.detect.CapabilityDetector;
import com.discusscall.core.error.CallErrorType;
import com.discusscall.core.error.CallException;
import com.discusscall.core.media.MediaAcquisitionService;
import com.discusscall.core.model.CallInvitation;
import com.discusscall.core.model.CallParticipant;
import com.discusscall.core.model.CallResult;
import com.discusscall.core.model.CallServiceStatus;
import com.discusscall.core.model.CallSession;
import com.discusscall.core.model.CallStatus;
import com.discusscall.core.model.CallStrategyType;
import com.discusscall.core.model.LocalIdentity;
import com.discusscall.core.model.MediaKind;
import com.discusscall.core.model.RegistryRecord;
import com.discusscall.core.registry.RegistryWatchListener;
import com.discusscall.core.registry.RegistryWatcher;
import com.discusscall.core.registry.SessionRegistryClient;
import com.discusscall.core.rtc.RemoteMediaHandle;
import com.discusscall.core.session.event.AudioToggledEvent;
import com.discusscall.core.session.event.CallAnsweredEvent;
import com.discusscall.core.session.event.CallConnectedEvent;
import com.discusscall.core.session.event.CallEndedEvent;
import com.discusscall.core.session.event.CallStartedEvent;
import com.discusscall.core.session.event.CallStatusChangedEvent;
import com.discusscall.core.session.event.ParticipantJoinedEvent;
import com.discusscall.core.session.event.RemoteStreamReceivedEvent;
import com.discusscall.core.session.event.VideoToggledEvent;
import com.discusscall.core.signaling.SignalingTransport;
import com.discusscall.core.strategy.CallCallbacks;
import com.discusscall.core.strategy.CallStrategy;
import com.discusscall.core.strategy.SessionResources;
import com.discusscall.core.strategy.StrategyAttempt;
import com.discusscall.core.strategy.StrategyChain;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 通话状态机，进程内唯一的通话所有者。
 *
 * idle -> connecting -> connected -> ended，failed 与 ended 并列，两者拆除完立即回到 idle。
 * 所有修改都在同一把锁下串行执行，两个几乎同时的操作不可能产生两条活跃通话。
 * 异步回调（peer 状态、registry 事件）带着 session 引用进来，已经被替换的通话直接忽略。
 */
@Service
@Slf4j
public class CallSessionManager implements CallCallbacks, RegistryWatchListener {

    private final StrategyChain strategies;
    private final CapabilityDetector detector;
    private final MediaAcquisitionService mediaAcquisition;
    private final SessionRegistryClient registry;
    private final RegistryWatcher registryWatcher;
    private final SignalingTransport transport;
    private final LocalIdentityProvider identityProvider;
    private final CallEventPublisher events;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    private volatile CallSession current;
    private RegistryWatcher.Watch currentWatch;
    private volatile boolean initialized;

    public CallSessionManager(StrategyChain strategies,
                              CapabilityDetector detector,
                              MediaAcquisitionService mediaAcquisition,
                              SessionRegistryClient registry,
                              RegistryWatcher registryWatcher,
                              SignalingTransport transport,
                              LocalIdentityProvider identityProvider,
                              CallEventPublisher events,
                              Clock clock) {
        this.strategies = strategies;
        this.detector = detector;
        this.mediaAcquisition = mediaAcquisition;
        this.registry = registry;
        this.registryWatcher = registryWatcher;
        this.transport = transport;
        this.identityProvider = identityProvider;
        this.events = events;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        detector.detect();
        initialized = true;
    }

    // ===================== 对 UI 的操作 =====================

    public CallResult startCall(long conversationId, String conversationName, MediaKind kind) {
        lock.lock();
        try {
            supersede();
            CallSession session = CallSession.connecting(conversationId, conversationName, kind, clock.instant());
            current = session;
            events.publish(new CallStatusChangedEvent(session.snapshot(), CallStatus.IDLE, CallStatus.CONNECTING));
            log.info("Starting {} call in conversation {}", kind.label(), conversationId);

            registry.cleanupSessions(conversationId);
            StrategyAttempt attempt = strategies.start(session, this);
            if (!attempt.isSuccess()) {
                return fail(session, attempt);
            }

            session.setCallId(attempt.getCallId());
            session.setStrategy(attempt.getStrategy());
            watch(session);
            log.info("Call {} started with {} strategy", session.getCallId(), attempt.getStrategy());
            events.publish(new CallStartedEvent(session.snapshot()));
            return CallResult.ok(session.snapshot());
        } finally {
            lock.unlock();
        }
    }

    public CallResult answerCall(CallInvitation invitation) {
        lock.lock();
        try {
            supersede();
            CallSession session = CallSession.connecting(invitation.getChannelId(),
                    invitation.getFromUserName(), invitation.getMediaKind(), clock.instant());
            session.setPeerRegistryId(invitation.getRegistryId());
            session.getParticipants().add(new CallParticipant(
                    invitation.getFromUserId(), invitation.getFromUserName(), null));
            current = session;
            events.publish(new CallStatusChangedEvent(session.snapshot(), CallStatus.IDLE, CallStatus.CONNECTING));
            log.info("Answering {} from {}", invitation.getCallId(), invitation.getFromUserName());

            registry.cleanupSessions(invitation.getChannelId());
            StrategyAttempt attempt = strategies.answer(session, invitation, this);
            if (!attempt.isSuccess()) {
                return fail(session, attempt);
            }

            session.setCallId(attempt.getCallId());
            session.setStrategy(attempt.getStrategy());
            watch(session);
            events.publish(new CallAnsweredEvent(session.snapshot(), invitation));
            if (strategies.strategy(attempt.getStrategy()).connectsOnAnswer()) {
                markConnected(session);
            }
            return CallResult.ok(session.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 本地挂断。先打断可能还在等待的权限申请，再拿锁，否则发起方一直占着锁。
     * 没有通话时什么也不做。
     */
    public void endCall() {
        mediaAcquisition.cancelPending();
        lock.lock();
        try {
            if (current == null) {
                log.debug("endCall with no active call");
                return;
            }
            teardown(current, CallStatus.ENDED, "local hang-up");
        } finally {
            lock.unlock();
        }
    }

    /** @return 切换后是否静音；没有通话时返回 false */
    public boolean toggleAudio() {
        lock.lock();
        try {
            CallSession s = current;
            if (s == null || s.getStrategy() == null) return false;
            boolean muted = strategies.strategy(s.getStrategy()).toggleAudio(s);
            events.publish(new AudioToggledEvent(s.snapshot(), muted));
            return muted;
        } finally {
            lock.unlock();
        }
    }

    /** @return 切换后摄像头是否打开；没有通话时返回 false */
    public boolean toggleVideo() {
        lock.lock();
        try {
            CallSession s = current;
            if (s == null || s.getStrategy() == null) return false;
            boolean cameraOn = strategies.strategy(s.getStrategy()).toggleVideo(s);
            events.publish(new VideoToggledEvent(s.snapshot(), cameraOn));
            return cameraOn;
        } finally {
            lock.unlock();
        }
    }

    /** 查询不拿锁，等待权限框期间也能读到 connecting 状态 */
    public Optional<CallSession> getCurrentCall() {
        return Optional.ofNullable(current).map(CallSession::snapshot);
    }

    public CallServiceStatus getStatus() {
        CallSession s = current;
        return CallServiceStatus.builder()
                .initialized(initialized)
                .activeCall(s != null)
                .status(s == null ? CallStatus.IDLE : s.getStatus())
                .mediaPermission(mediaAcquisition.hasPermission(MediaKind.AUDIO))
                .strategy(s == null ? detector.detect() : s.getStrategy())
                .muted(s != null && s.isMuted())
                .cameraOn(s != null && s.isCameraOn())
                .build();
    }

    // ===================== 异步回调 =====================

    @Override
    public void onRemoteConnected(CallSession session) {
        lock.lock();
        try {
            if (isStale(session)) return;
            markConnected(session);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onRemoteMedia(CallSession session, RemoteMediaHandle media) {
        lock.lock();
        try {
            if (isStale(session)) return;
            session.setRemoteMedia(media);
            events.publish(new RemoteStreamReceivedEvent(session.snapshot(), media));
            markConnected(session);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onSignalingError(CallSession session, CallException error) {
        lock.lock();
        try {
            if (isStale(session)) return;
            log.warn("Unrecoverable signaling error on {}: {}", session.getCallId(), error.getMessage());
            teardown(session, CallStatus.ENDED, "signaling error");
        } finally {
            lock.unlock();
        }
    }

    /**
     * 后端通知某条 registry 记录被删除。只有本通话的本端/对端记录才会结束通话。
     */
    @Override
    public void onRegistryRemoved(long registryId) {
        lock.lock();
        try {
            CallSession s = current;
            if (s == null || !s.isTrackedRecord(registryId)) {
                log.debug("Removal of untracked record {} ignored", registryId);
                return;
            }
            teardown(s, CallStatus.ENDED, "registry record " + registryId + " removed");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onParticipantJoined(RegistryRecord record) {
        lock.lock();
        try {
            CallSession s = current;
            if (s == null || s.getConversationId() != record.getConversationId()
                    || s.isOwnRecord(record.getId()) || isSelf(record.getPartnerId())) {
                return;
            }
            if (!s.hasParticipant(record.getPartnerId())) {
                CallParticipant p = new CallParticipant(record.getPartnerId(), record.getPartnerName(), null);
                s.getParticipants().add(p);
                log.info("Participant {} joined call {}", record.getPartnerId(), s.getCallId());
                events.publish(new ParticipantJoinedEvent(s.snapshot(), p));
            }
            // full-media 的 connected 以传输层为准
            if (s.getStrategy() != null && s.getStrategy() != CallStrategyType.FULL_MEDIA) {
                markConnected(s);
            }
        } finally {
            lock.unlock();
        }
    }

    // ===================== 内部 =====================

    private boolean isStale(CallSession session) {
        return session == null || session != current;
    }

    private boolean isSelf(long partnerId) {
        return identityProvider.tryGet().map(LocalIdentity::getPartnerId)
                .map(id -> id == partnerId)
                .orElse(false);
    }

    private void supersede() {
        if (current != null) {
            log.info("Superseding call {}", current.getCallId());
            teardown(current, CallStatus.ENDED, "superseded");
        }
    }

    private void markConnected(CallSession session) {
        if (session.getStatus() != CallStatus.CONNECTING) return;
        session.setStatus(CallStatus.CONNECTED);
        log.info("Call {} connected", session.getCallId());
        events.publish(new CallStatusChangedEvent(session.snapshot(), CallStatus.CONNECTING, CallStatus.CONNECTED));
        events.publish(new CallConnectedEvent(session.snapshot()));
    }

    private void watch(CallSession session) {
        if (session.getRegistryId() == null && session.getPeerRegistryId() == null) {
            return;
        }
        currentWatch = registryWatcher.watch(session.getConversationId(),
                session.getRegistryId(), session.getPeerRegistryId(), this);
    }

    private CallResult fail(CallSession session, StrategyAttempt attempt) {
        CallException error = attempt.getError();
        CallStatus terminal = error != null && !error.isRetryable() ? CallStatus.FAILED : CallStatus.ENDED;
        // FAILED 只留给重试也没用的情况，例如权限被永久拒绝
        CallErrorType type = error == null ? CallErrorType.STRATEGY_UNAVAILABLE : error.getType();
        log.warn("Call setup in conversation {} failed: {}", session.getConversationId(), type);
        teardown(session, terminal, "setup failed");
        return CallResult.failed(type);
    }

    /**
     * 拆除：停本地媒体 -> 关 peer -> 计算时长 -> 删 registry 记录 -> 取消轮询
     * -> 清空当前通话 -> callEnded -> 回到 idle。任何一步失败都不影响后面的步骤。
     */
    private void teardown(CallSession session, CallStatus terminal, String reason) {
        CallStatus previous = session.getStatus();
        log.info("Tearing down call {} ({})", session.getCallId(), reason);

        if (session.getStrategy() != null && session.getCallId() != null) {
            try {
                CallStrategy strategy = strategies.strategy(session.getStrategy());
                strategy.end(session);
            } catch (RuntimeException e) {
                log.warn("Strategy cleanup failed for {}: {}", session.getCallId(), e.getMessage());
            }
        }
        SessionResources.closeSubscription(session);
        SessionResources.stopMedia(session);
        SessionResources.closePeer(session);

        session.finish(terminal, clock.instant());
        if (!Objects.equals(previous, session.getStatus())) {
            events.publish(new CallStatusChangedEvent(session.snapshot(), previous, session.getStatus()));
        }

        if (session.getRegistryId() != null) {
            try {
                registry.endSession(session.getRegistryId());
            } catch (CallException e) {
                log.warn("Registry record {} not removed: {}", session.getRegistryId(), e.getMessage());
            }
        }

        if (currentWatch != null) {
            currentWatch.cancel();
            currentWatch = null;
        }
        transport.discardInbox(session.getConversationId());

        if (current == session) {
            current = null;
        }
        CallSession ended = session.snapshot();
        events.publish(new CallEndedEvent(ended));
        events.publish(new CallStatusChangedEvent(ended, ended.getStatus(), CallStatus.IDLE));
        log.info("Call {} ended after {}ms", session.getCallId(),
                session.getDuration() == null ? 0 : session.getDuration().toMillis());
    }
}
