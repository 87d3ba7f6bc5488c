package com.discusscall.core.detect;

import com.discusscall.core.config.CallProperties;
import com.discusscall.core.media.MediaPlatform;
import com.discusscall.core.model.CallStrategyType;
import com.discusscall.core.rtc.PeerConnectionEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 根据运行环境决定通话档位：
 * - 有 PeerConnectionEngine 且有 MediaPlatform -> FULL_MEDIA
 * - 只有 PeerConnectionEngine                  -> SIGNALING_ONLY
 * - 都没有                                     -> MINIMAL
 * 配置了 strategy-override 时以配置为准。
 *
 * 没有副作用，可以反复调用；同样的结论只打一次日志。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CapabilityDetector {

    private final ObjectProvider<PeerConnectionEngine> engineProvider;
    private final ObjectProvider<MediaPlatform> mediaProvider;
    private final CallProperties properties;

    private final AtomicReference<CallStrategyType> lastLogged = new AtomicReference<>();

    public CallStrategyType detect() {
        CallStrategyType result;
        String reason;
        try {
            if (properties.getStrategyOverride() != null) {
                result = properties.getStrategyOverride();
                reason = "strategy-override";
            } else if (engineProvider.getIfAvailable() == null) {
                result = CallStrategyType.MINIMAL;
                reason = "no peer-connection engine";
            } else if (mediaProvider.getIfAvailable() == null) {
                result = CallStrategyType.SIGNALING_ONLY;
                reason = "peer-connection engine without media platform";
            } else {
                result = CallStrategyType.FULL_MEDIA;
                reason = "peer-connection engine and media platform present";
            }
        } catch (RuntimeException e) {
            result = CallStrategyType.MINIMAL;
            reason = "capability probe failed: " + e.getMessage();
        }

        if (lastLogged.getAndSet(result) != result) {
            log.info("Call capability: {} ({})", result, reason);
        }
        return result;
    }

    public boolean isPeerConnectionAvailable() {
        try {
            return engineProvider.getIfAvailable() != null;
        } catch (RuntimeException e) {
            log.debug("Peer-connection probe failed: {}", e.getMessage());
            return false;
        }
    }
}
