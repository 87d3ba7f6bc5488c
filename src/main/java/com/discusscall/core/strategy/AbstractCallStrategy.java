package com.discusscall.core.strategy;

import com.discusscall.core.backend.LocalIdentityProvider;
import com.discusscall.core.error.CallException;
import com.discusscall.core.model.CallSession;
import com.discusscall.core.model.LocalIdentity;
import com.discusscall.core.model.MediaKind;
import com.discusscall.core.model.RegistryRecord;
import com.discusscall.core.model.SessionFlags;
import com.discusscall.core.registry.SessionRegistryClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * 三个策略共用的部分：registry 记录、静音/摄像头开关的同步。
 */
@Slf4j
public abstract class AbstractCallStrategy implements CallStrategy {

    static final String FALLBACK_NAME = "Mobile User";

    protected final SessionRegistryClient registry;
    protected final LocalIdentityProvider identityProvider;
    protected final Clock clock;

    protected AbstractCallStrategy(SessionRegistryClient registry,
                                   LocalIdentityProvider identityProvider,
                                   Clock clock) {
        this.registry = registry;
        this.identityProvider = identityProvider;
        this.clock = clock;
    }

    @Override
    public boolean toggleAudio(CallSession session) {
        boolean muted = !session.isMuted();
        applyAudio(session, muted);
        session.setMuted(muted);
        pushFlags(session, SessionFlags.builder().muted(muted).build());
        return muted;
    }

    @Override
    public boolean toggleVideo(CallSession session) {
        if (!session.getMediaKind().isVideo()) {
            log.debug("Ignoring camera toggle on audio call {}", session.getCallId());
            return session.isCameraOn();
        }
        boolean cameraOn = !session.isCameraOn();
        applyVideo(session, cameraOn);
        session.setCameraOn(cameraOn);
        pushFlags(session, SessionFlags.builder().cameraOn(cameraOn).build());
        return cameraOn;
    }

    /** 本地轨道上的开关，默认没有本地媒体 */
    protected void applyAudio(CallSession session, boolean muted) {
    }

    protected void applyVideo(CallSession session, boolean cameraOn) {
    }

    protected RegistryRecord publishRecord(CallSession session, MediaKind kind) {
        RegistryRecord record = registry.createSession(session.getConversationId(), kind);
        session.setRegistryId(record.getId());
        session.setMembershipId(record.getMembershipId());
        return record;
    }

    protected String localName() {
        return identityProvider.tryGet().map(LocalIdentity::getName).orElse(FALLBACK_NAME);
    }

    private void pushFlags(CallSession session, SessionFlags flags) {
        if (session.getRegistryId() == null) return;
        try {
            registry.updateFlags(session.getRegistryId(), flags);
        } catch (CallException e) {
            log.warn("Could not sync flags to registry record {}: {}", session.getRegistryId(), e.getMessage());
        }
    }
}
