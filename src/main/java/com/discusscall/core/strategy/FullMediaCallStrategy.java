package com.discusscall.core.strategy;

import com.discusscall.core.backend.LocalIdentityProvider;
import com.discusscall.core.config.CallProperties;
import com.discusscall.core.error.CallException;
import com.discusscall.core.error.SignalingFailureException;
import com.discusscall.core.error.StrategyUnavailableException;
import com.discusscall.core.media.LocalMediaHandle;
import com.discusscall.core.media.MediaAcquisitionService;
import com.discusscall.core.media.MediaTrack;
import com.discusscall.core.model.CallInvitation;
import com.discusscall.core.model.CallSession;
import com.discusscall.core.model.CallStrategyType;
import com.discusscall.core.model.IceCandidate;
import com.discusscall.core.model.MediaKind;
import com.discusscall.core.model.RegistryRecord;
import com.discusscall.core.model.SessionDescription;
import com.discusscall.core.model.SignalingEnvelope;
import com.discusscall.core.registry.SessionRegistryClient;
import com.discusscall.core.rtc.NegotiatingPeer;
import com.discusscall.core.rtc.PeerConnection;
import com.discusscall.core.rtc.PeerConnectionEngine;
import com.discusscall.core.rtc.PeerConnectionObserver;
import com.discusscall.core.rtc.PeerConnectionState;
import com.discusscall.core.rtc.RemoteMediaHandle;
import com.discusscall.core.rtc.RtcConfiguration;
import com.discusscall.core.signaling.SignalingTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * 完整的 WebRTC 通话：
 * 本地采集 -> 建 peer connection（公共 STUN）-> 挂本地轨道 -> 本地 ICE 通过信令转发
 * -> 建 registry 记录 -> 发 offer -> 收到 answer / ICE 后应用 -> 远端轨道到达即 connected。
 */
@Component
@Slf4j
public class FullMediaCallStrategy extends AbstractCallStrategy {

    private final ObjectProvider<PeerConnectionEngine> engineProvider;
    private final MediaAcquisitionService mediaAcquisition;
    private final SignalingTransport transport;
    private final CallProperties properties;

    public FullMediaCallStrategy(SessionRegistryClient registry,
                                 LocalIdentityProvider identityProvider,
                                 Clock clock,
                                 ObjectProvider<PeerConnectionEngine> engineProvider,
                                 MediaAcquisitionService mediaAcquisition,
                                 SignalingTransport transport,
                                 CallProperties properties) {
        super(registry, identityProvider, clock);
        this.engineProvider = engineProvider;
        this.mediaAcquisition = mediaAcquisition;
        this.transport = transport;
        this.properties = properties;
    }

    @Override
    public CallStrategyType type() {
        return CallStrategyType.FULL_MEDIA;
    }

    @Override
    public boolean isAvailable() {
        return engineProvider.getIfAvailable() != null && mediaAcquisition.isAvailable();
    }

    @Override
    public boolean connectsOnAnswer() {
        return false;
    }

    @Override
    public String start(CallSession session, CallCallbacks callbacks) {
        long conversationId = session.getConversationId();
        NegotiatingPeer peer = prepare(session, session.getMediaKind(), callbacks);
        session.setSignalingSubscription(transport.onEnvelope(conversationId,
                env -> onCallerEnvelope(session, peer, env, callbacks)));

        RegistryRecord record = publishRecord(session, session.getMediaKind());
        SessionDescription offer = peer.createOffer(session.getMediaKind());
        transport.sendOffer(conversationId, record.getId(), offer);

        log.info("Full-media call offered: conversation={}, registryId={}", conversationId, record.getId());
        return CallIdFormat.format(type(), record.getId(), clock.instant());
    }

    @Override
    public void answer(CallSession session, CallInvitation invitation, CallCallbacks callbacks) {
        long conversationId = session.getConversationId();
        NegotiatingPeer peer = prepare(session, invitation.getMediaKind(), callbacks);
        session.setSignalingSubscription(transport.onEnvelope(conversationId,
                env -> onCalleeEnvelope(session, peer, invitation, env, callbacks)));

        publishRecord(session, invitation.getMediaKind());

        Optional<SignalingEnvelope> offer = transport.takeOffer(conversationId, invitation.getRegistryId());
        if (offer.isPresent()) {
            respond(session, peer, invitation, offer.get().getDescription());
        } else {
            log.info("No offer yet for {}, waiting on signaling", invitation.getCallId());
        }

        // 响铃期间对方已经发出的 candidate；还没有 offer 时由 NegotiatingPeer 暂存
        List<SignalingEnvelope> early = transport.takeCandidates(conversationId, invitation.getRegistryId());
        if (!early.isEmpty()) {
            log.debug("Replaying {} ICE candidate(s) received while ringing", early.size());
            early.forEach(env -> peer.addRemoteCandidate(env.getCandidate()));
        }
    }

    @Override
    public void end(CallSession session) {
        SessionResources.closeSubscription(session);
    }

    @Override
    protected void applyAudio(CallSession session, boolean muted) {
        LocalMediaHandle media = session.getLocalMedia();
        if (media != null) {
            media.audioTracks().forEach(t -> t.setEnabled(!muted));
        }
    }

    @Override
    protected void applyVideo(CallSession session, boolean cameraOn) {
        LocalMediaHandle media = session.getLocalMedia();
        if (media != null) {
            for (MediaTrack t : media.videoTracks()) {
                t.setEnabled(cameraOn);
            }
        }
    }

    private NegotiatingPeer prepare(CallSession session, MediaKind kind, CallCallbacks callbacks) {
        LocalMediaHandle media = mediaAcquisition.acquire(kind);
        session.setLocalMedia(media);

        PeerConnectionEngine engine = engineProvider.getIfAvailable();
        if (engine == null) {
            throw new StrategyUnavailableException("no peer-connection engine in this runtime");
        }
        PeerConnection connection;
        try {
            connection = engine.create(RtcConfiguration.from(properties), observer(session, callbacks));
        } catch (RuntimeException e) {
            throw new StrategyUnavailableException("peer connection could not be created", e);
        }
        NegotiatingPeer peer = new NegotiatingPeer(connection);
        session.setPeer(peer);
        peer.attach(media);
        return peer;
    }

    private PeerConnectionObserver observer(CallSession session, CallCallbacks callbacks) {
        return new PeerConnectionObserver() {
            @Override
            public void onIceCandidate(IceCandidate candidate) {
                relayCandidate(session, candidate);
            }

            @Override
            public void onRemoteMedia(RemoteMediaHandle media) {
                callbacks.onRemoteMedia(session, media);
            }

            @Override
            public void onConnectionStateChange(PeerConnectionState state) {
                log.debug("Peer connection state: {}", state);
                if (state == PeerConnectionState.CONNECTED) {
                    callbacks.onRemoteConnected(session);
                } else if (state == PeerConnectionState.FAILED) {
                    callbacks.onSignalingError(session,
                            new SignalingFailureException("peer connection failed", null));
                }
            }
        };
    }

    private void relayCandidate(CallSession session, IceCandidate candidate) {
        try {
            transport.sendIceCandidate(session.getConversationId(), session.getRegistryId(), candidate);
        } catch (SignalingFailureException e) {
            // 已交换的 candidate 仍可能打通，只降级不结束
            log.warn("ICE candidate not relayed, call degraded: {}", e.getMessage());
        }
    }

    private void onCallerEnvelope(CallSession session, NegotiatingPeer peer,
                                  SignalingEnvelope env, CallCallbacks callbacks) {
        try {
            switch (env.getKind()) {
                case ANSWER -> {
                    if (env.getRegistryId() != null && !session.isOwnRecord(env.getRegistryId())) {
                        log.debug("Answer for another record {}, ignored", env.getRegistryId());
                    } else if (peer.hasRemoteDescription()) {
                        log.debug("Duplicate answer ignored");
                    } else {
                        peer.acceptAnswer(env.getDescription());
                    }
                }
                case ICE_CANDIDATE -> peer.addRemoteCandidate(env.getCandidate());
                case OFFER -> log.debug("Offer received while calling, ignored");
            }
        } catch (RuntimeException e) {
            callbacks.onSignalingError(session, new SignalingFailureException("could not apply " + env.getKind(), e));
        }
    }

    private void onCalleeEnvelope(CallSession session, NegotiatingPeer peer, CallInvitation invitation,
                                  SignalingEnvelope env, CallCallbacks callbacks) {
        try {
            switch (env.getKind()) {
                case OFFER -> {
                    boolean ours = env.getRegistryId() == null || invitation.getRegistryId() == null
                            || env.getRegistryId().equals(invitation.getRegistryId());
                    if (ours && !peer.hasRemoteDescription()) {
                        transport.takeOffer(env.getConversationId(), env.getRegistryId());
                        respond(session, peer, invitation, env.getDescription());
                    }
                }
                case ICE_CANDIDATE -> peer.addRemoteCandidate(env.getCandidate());
                case ANSWER -> log.debug("Answer received while answering, ignored");
            }
        } catch (CallException e) {
            callbacks.onSignalingError(session, e);
        } catch (RuntimeException e) {
            callbacks.onSignalingError(session, new SignalingFailureException("could not apply " + env.getKind(), e));
        }
    }

    private void respond(CallSession session, NegotiatingPeer peer, CallInvitation invitation,
                         SessionDescription offer) {
        SessionDescription answer = peer.acceptOffer(offer);
        transport.sendAnswer(session.getConversationId(), invitation.getRegistryId(), answer);
        log.info("Answered {} with local description", invitation.getCallId());
    }
}
