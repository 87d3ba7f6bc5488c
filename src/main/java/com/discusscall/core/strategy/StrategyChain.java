package com.discusscall.core.strategy;

import com.discusscall.core.detect.CapabilityDetector;
import com.discusscall.core.error.CallException;
import com.discusscall.core.error.StrategyUnavailableException;
import com.discusscall.core.model.CallInvitation;
import com.discusscall.core.model.CallSession;
import com.discusscall.core.model.CallStrategyType;
import com.discusscall.core.registry.SessionRegistryClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 按档位依次尝试：
 * FULL_MEDIA -> MINIMAL，SIGNALING_ONLY -> MINIMAL，MINIMAL 只有自己。
 * 能让对方响铃的通话总比没有通话好。每档失败后先释放它留下的资源再试下一档；
 * 用户主动取消（CANCELLED）不再降级。
 */
@Component
@Slf4j
public class StrategyChain {

    private static final Map<CallStrategyType, List<CallStrategyType>> TIERS = Map.of(
            CallStrategyType.FULL_MEDIA, List.of(CallStrategyType.FULL_MEDIA, CallStrategyType.MINIMAL),
            CallStrategyType.SIGNALING_ONLY, List.of(CallStrategyType.SIGNALING_ONLY, CallStrategyType.MINIMAL),
            CallStrategyType.MINIMAL, List.of(CallStrategyType.MINIMAL)
    );

    private final Map<CallStrategyType, CallStrategy> strategies = new EnumMap<>(CallStrategyType.class);
    private final CapabilityDetector detector;
    private final SessionRegistryClient registry;
    private final Clock clock;

    public StrategyChain(List<CallStrategy> strategies,
                         CapabilityDetector detector,
                         SessionRegistryClient registry,
                         Clock clock) {
        strategies.forEach(s -> this.strategies.put(s.type(), s));
        this.detector = detector;
        this.registry = registry;
        this.clock = clock;
    }

    public CallStrategy strategy(CallStrategyType type) {
        CallStrategy s = strategies.get(type);
        if (s == null) {
            throw new StrategyUnavailableException("no " + type + " strategy registered");
        }
        return s;
    }

    public StrategyAttempt start(CallSession session, CallCallbacks callbacks) {
        return attempt(session, s -> s.start(session, callbacks));
    }

    public StrategyAttempt answer(CallSession session, CallInvitation invitation, CallCallbacks callbacks) {
        return attempt(session, s -> {
            s.answer(session, invitation, callbacks);
            return CallIdFormat.format(s.type(), session.getRegistryId(), clock.instant());
        });
    }

    private StrategyAttempt attempt(CallSession session, Function<CallStrategy, String> step) {
        CallStrategyType detected = detector.detect();
        CallException last = null;
        CallException permanent = null;
        CallStrategyType lastType = detected;

        for (CallStrategyType type : TIERS.get(detected)) {
            lastType = type;
            session.setStrategy(type);
            try {
                CallStrategy strategy = strategy(type);
                if (!strategy.isAvailable()) {
                    throw new StrategyUnavailableException(type + " prerequisites missing");
                }
                String callId = step.apply(strategy);
                if (last != null) {
                    log.info("Fell back to {} after {}", type, last.getType());
                }
                return StrategyAttempt.success(type, callId);
            } catch (CallException e) {
                last = e;
            } catch (RuntimeException e) {
                last = new StrategyUnavailableException(type + " setup failed", e);
            }

            if (permanent == null && !last.isRetryable()) {
                permanent = last;
            }
            release(session);
            if (last.isCancelled()) {
                log.info("{} setup cancelled", type);
                break;
            }
            log.warn("{} strategy failed: {} ({})", type, last.getType(), last.getMessage());
        }
        // 有不可重试的错误时优先报告它
        return StrategyAttempt.failure(lastType, permanent != null ? permanent : last);
    }

    /**
     * 释放失败档位留下的东西，让下一档从干净的 session 开始。
     */
    void release(CallSession session) {
        SessionResources.closeSubscription(session);
        SessionResources.stopMedia(session);
        SessionResources.closePeer(session);
        if (session.getRegistryId() != null) {
            try {
                registry.endSession(session.getRegistryId());
            } catch (CallException e) {
                log.warn("Could not remove registry record {} of failed attempt: {}",
                        session.getRegistryId(), e.getMessage());
            }
        }
        session.setLocalMedia(null);
        session.setPeer(null);
        session.setRemoteMedia(null);
        session.setRegistryId(null);
        session.setMembershipId(null);
        session.setMuted(false);
        session.setCameraOn(session.getMediaKind().isVideo());
    }
}
