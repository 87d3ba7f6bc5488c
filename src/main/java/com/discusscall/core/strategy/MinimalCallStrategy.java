package com.discusscall.core.strategy;

import com.discusscall.core.backend.LocalIdentityProvider;
import com.discusscall.core.error.RegistryFailureException;
import com.discusscall.core.model.CallInvitation;
import com.discusscall.core.model.CallSession;
import com.discusscall.core.model.CallStrategyType;
import com.discusscall.core.model.MediaKind;
import com.discusscall.core.registry.SessionRegistryClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 最低档：registry 记录 + 一条“发起了通话”的会话消息，客户端不做任何媒体协商。
 * 状态完全依赖记录的出现/消失。registry 不可用时仍然发消息让对方看到来电，
 * 但 membership 缺失不降级，直接报错。
 */
@Component
@Slf4j
public class MinimalCallStrategy extends AbstractCallStrategy {

    private final CallNotifier notifier;

    public MinimalCallStrategy(SessionRegistryClient registry,
                               LocalIdentityProvider identityProvider,
                               Clock clock,
                               CallNotifier notifier) {
        super(registry, identityProvider, clock);
        this.notifier = notifier;
    }

    @Override
    public CallStrategyType type() {
        return CallStrategyType.MINIMAL;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String start(CallSession session, CallCallbacks callbacks) {
        tryPublish(session, session.getMediaKind());
        notifier.callStarted(session.getConversationId(), localName(), session.getMediaKind());
        return CallIdFormat.format(type(), session.getRegistryId(), clock.instant());
    }

    @Override
    public void answer(CallSession session, CallInvitation invitation, CallCallbacks callbacks) {
        tryPublish(session, invitation.getMediaKind());
        notifier.callAnswered(session.getConversationId(), localName());
    }

    @Override
    public void end(CallSession session) {
        notifier.callEnded(session.getConversationId(), localName());
    }

    private void tryPublish(CallSession session, MediaKind kind) {
        try {
            publishRecord(session, kind);
        } catch (RegistryFailureException e) {
            log.warn("Registry unavailable, continuing with message-only call in conversation {}: {}",
                    session.getConversationId(), e.getMessage());
        }
    }
}
