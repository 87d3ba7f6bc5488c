package com.discusscall.core.strategy;

import com.discusscall.core.backend.LocalIdentityProvider;
import com.discusscall.core.error.SignalingFailureException;
import com.discusscall.core.model.CallInvitation;
import com.discusscall.core.model.CallSession;
import com.discusscall.core.model.CallStrategyType;
import com.discusscall.core.model.EnvelopeKind;
import com.discusscall.core.model.IceCandidate;
import com.discusscall.core.model.MediaKind;
import com.discusscall.core.model.RegistryRecord;
import com.discusscall.core.model.SessionDescription;
import com.discusscall.core.registry.SessionRegistryClient;
import com.discusscall.core.signaling.SignalingTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 只走 registry 记录 + 信令消息，不碰麦克风、摄像头和真实的 peer connection。
 * 用来验证信令链路端到端可达：收到对端 answer 就算连通。
 */
@Component
@Slf4j
public class SignalingOnlyCallStrategy extends AbstractCallStrategy {

    static final IceCandidate PROBE_CANDIDATE =
            new IceCandidate("candidate:probe 1 udp 2122260223 127.0.0.1 9 typ host", "0", 0);

    private final SignalingTransport transport;

    public SignalingOnlyCallStrategy(SessionRegistryClient registry,
                                     LocalIdentityProvider identityProvider,
                                     Clock clock,
                                     SignalingTransport transport) {
        super(registry, identityProvider, clock);
        this.transport = transport;
    }

    @Override
    public CallStrategyType type() {
        return CallStrategyType.SIGNALING_ONLY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String start(CallSession session, CallCallbacks callbacks) {
        long conversationId = session.getConversationId();
        session.setSignalingSubscription(transport.onEnvelope(conversationId, env -> {
            boolean forUs = env.getRegistryId() == null || session.isOwnRecord(env.getRegistryId());
            if (env.getKind() == EnvelopeKind.ANSWER && forUs) {
                log.info("Signaling path verified by answer in conversation {}", conversationId);
                callbacks.onRemoteConnected(session);
            }
        }));

        RegistryRecord record = publishRecord(session, session.getMediaKind());
        transport.sendOffer(conversationId, record.getId(), probeDescription("offer", session.getMediaKind()));
        return CallIdFormat.format(type(), record.getId(), clock.instant());
    }

    @Override
    public void answer(CallSession session, CallInvitation invitation, CallCallbacks callbacks) {
        publishRecord(session, invitation.getMediaKind());
        transport.takeOffer(session.getConversationId(), invitation.getRegistryId());
        transport.sendAnswer(session.getConversationId(), invitation.getRegistryId(),
                probeDescription("answer", invitation.getMediaKind()));
    }

    @Override
    public void end(CallSession session) {
        SessionResources.closeSubscription(session);
    }

    /**
     * 发一个探测 offer 和一个探测 ICE candidate，两条都发出去才算链路可用。
     */
    public boolean verifyTransport(long conversationId) {
        try {
            transport.sendOffer(conversationId, null, probeDescription("offer", MediaKind.AUDIO));
            transport.sendIceCandidate(conversationId, null, PROBE_CANDIDATE);
            log.info("Signaling transport verified for conversation {}", conversationId);
            return true;
        } catch (SignalingFailureException e) {
            log.warn("Signaling transport check failed for conversation {}: {}", conversationId, e.getMessage());
            return false;
        }
    }

    static SessionDescription probeDescription(String type, MediaKind kind) {
        StringBuilder sdp = new StringBuilder()
                .append("v=0\r\n")
                .append("o=- 0 0 IN IP4 127.0.0.1\r\n")
                .append("s=signaling-probe\r\n")
                .append("t=0 0\r\n")
                .append("m=audio 9 UDP/TLS/RTP/SAVPF 111\r\n");
        if (kind.isVideo()) {
            sdp.append("m=video 9 UDP/TLS/RTP/SAVPF 96\r\n");
        }
        return new SessionDescription(type, sdp.toString());
    }
}
