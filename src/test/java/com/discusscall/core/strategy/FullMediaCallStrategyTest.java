package com.discusscall.core.strategy;

import com.discusscall.core.model.CallInvitation;
import com.discusscall.core.model.CallSession;
import com.discusscall.core.model.CallStatus;
import com.discusscall.core.model.CallStrategyType;
import com.discusscall.core.model.IceCandidate;
import com.discusscall.core.model.InvitationSource;
import com.discusscall.core.model.MediaKind;
import com.discusscall.core.model.RegistryRecord;
import com.discusscall.core.rtc.RtcConfiguration;
import com.discusscall.core.session.event.CallConnectedEvent;
import com.discusscall.core.session.event.CallEndedEvent;
import com.discusscall.core.support.CallCoreFixture;
import com.discusscall.core.support.FakeDiscussBackend;
import com.discusscall.core.support.FakePeerConnectionEngine.FakePeerConnection;
import com.discusscall.core.support.SignalingMessages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FullMediaCallStrategyTest {

    private static final long CONV = 7L;
    private static final long PEER = 99L;

    private CallCoreFixture fx;

    @BeforeEach
    void setUp() {
        fx = new CallCoreFixture();
        fx.backend.conversation(CONV, "Ops", false).member(CONV, FakeDiscussBackend.MY_PARTNER);
        fx.mediaPlatform.permitted = true;
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    void peerUsesPublicStunPoolAndCarriesLocalTracks() {
        fx.manager.startCall(CONV, "Ops", MediaKind.AUDIO_VIDEO);

        RtcConfiguration config = fx.engine.lastConfiguration;
        assertThat(config.getIceServers()).hasSize(5).allMatch(s -> s.startsWith("stun:"));
        assertThat(config.getIceCandidatePoolSize()).isEqualTo(10);
        assertThat(fx.engine.last().tracks).hasSize(2);
        assertThat(fx.engine.last().local.hasVideo()).isTrue();
    }

    @Test
    void localCandidatesAreRelayedThroughTheConversation() {
        CallSession call = fx.manager.startCall(CONV, "Ops", MediaKind.AUDIO).getCall();

        assertThat(fx.backend.postedTo(CONV))
                .anyMatch(p -> "WebRTC ICE Candidate".equals(p.getMessage().getSubject())
                        && p.getMessage().getBody().contains("\"sessionId\":" + call.getRegistryId()));
    }

    @Test
    void callerConnectsAfterEarlyCandidateAndLateAnswer() {
        CallSession call = fx.manager.startCall(CONV, "Ops", MediaKind.AUDIO).getCall();

        fx.transport.handleIncomingMessage(SignalingMessages.candidate(CONV, PEER, call.getRegistryId()));
        FakePeerConnection pc = fx.engine.last();
        assertThat(pc.applied).isEmpty();

        fx.transport.handleIncomingMessage(SignalingMessages.answer(CONV, PEER, call.getRegistryId(), "v=0"));

        assertThat(pc.applied).hasSize(1);
        assertThat(fx.manager.getStatus().getStatus()).isEqualTo(CallStatus.CONNECTED);
        assertThat(fx.eventsOf(CallConnectedEvent.class)).hasSize(1);
    }

    @Test
    void answerForAnotherRecordIsIgnored() {
        CallSession call = fx.manager.startCall(CONV, "Ops", MediaKind.AUDIO).getCall();

        fx.transport.handleIncomingMessage(SignalingMessages.answer(CONV, PEER, call.getRegistryId() + 1, "v=0"));

        assertThat(fx.engine.last().remote).isNull();
        assertThat(fx.manager.getStatus().getStatus()).isEqualTo(CallStatus.CONNECTING);
    }

    @Test
    void calleeConnectsWhenCandidateArrivesBeforeOffer() {
        RegistryRecord callerRecord = fx.backend.addRecord(CONV, PEER, "Alex");

        fx.manager.answerCall(invitation(callerRecord));
        CallSession answering = fx.manager.getCurrentCall().orElseThrow();
        assertThat(answering.getStrategy()).isEqualTo(CallStrategyType.FULL_MEDIA);
        assertThat(answering.getStatus()).isEqualTo(CallStatus.CONNECTING);

        fx.transport.handleIncomingMessage(SignalingMessages.candidate(CONV, PEER, callerRecord.getId()));
        fx.transport.handleIncomingMessage(SignalingMessages.offer(CONV, PEER, callerRecord.getId(), "v=0"));

        assertThat(fx.manager.getStatus().getStatus()).isEqualTo(CallStatus.CONNECTED);
        assertThat(fx.backend.postedTo(CONV))
                .anyMatch(p -> "WebRTC SDP Answer".equals(p.getMessage().getSubject())
                        && p.getMessage().getBody().contains("\"sessionId\":" + callerRecord.getId()));
    }

    @Test
    void offerThatArrivedBeforeAnsweringIsPickedUpFromTheInbox() {
        RegistryRecord callerRecord = fx.backend.addRecord(CONV, PEER, "Alex");
        fx.transport.handleIncomingMessage(SignalingMessages.offer(CONV, PEER, callerRecord.getId(), "v=0"));

        fx.manager.answerCall(invitation(callerRecord));

        assertThat(fx.engine.last().remote).isNotNull();
        assertThat(fx.backend.postedTo(CONV))
                .anyMatch(p -> "WebRTC SDP Answer".equals(p.getMessage().getSubject()));
    }

    @Test
    void candidatesSentWhileRingingAreAppliedOnAnswer() {
        RegistryRecord callerRecord = fx.backend.addRecord(CONV, PEER, "Alex");
        fx.transport.handleIncomingMessage(SignalingMessages.offer(CONV, PEER, callerRecord.getId(), "v=0"));
        fx.transport.handleIncomingMessage(SignalingMessages.candidate(CONV, PEER, callerRecord.getId()));

        fx.manager.answerCall(invitation(callerRecord));

        FakePeerConnection pc = fx.engine.last();
        assertThat(pc.remote).isNotNull();
        assertThat(pc.applied).hasSize(1);
        assertThat(fx.manager.getStatus().getStatus()).isEqualTo(CallStatus.CONNECTED);
        assertThat(fx.transport.takeCandidates(CONV, callerRecord.getId())).isEmpty();
    }

    @Test
    void candidatesSentBeforeTheOfferWaitInThePeerUntilItArrives() {
        RegistryRecord callerRecord = fx.backend.addRecord(CONV, PEER, "Alex");
        fx.transport.handleIncomingMessage(SignalingMessages.candidate(CONV, PEER, callerRecord.getId()));

        fx.manager.answerCall(invitation(callerRecord));
        assertThat(fx.manager.getStatus().getStatus()).isEqualTo(CallStatus.CONNECTING);

        fx.transport.handleIncomingMessage(SignalingMessages.offer(CONV, PEER, callerRecord.getId(), "v=0"));

        assertThat(fx.engine.last().applied).hasSize(1);
        assertThat(fx.manager.getStatus().getStatus()).isEqualTo(CallStatus.CONNECTED);
    }

    @Test
    void failedPeerConnectionEndsTheCall() {
        fx.manager.startCall(CONV, "Ops", MediaKind.AUDIO);

        fx.engine.last().fail();

        assertThat(fx.manager.getCurrentCall()).isEmpty();
        assertThat(fx.eventsOf(CallEndedEvent.class)).hasSize(1);
    }

    @Test
    void candidateRelayFailureDoesNotAbortTheCall() {
        CallSession call = fx.manager.startCall(CONV, "Ops", MediaKind.AUDIO).getCall();
        fx.backend.failNextPosts = 2;

        fx.engine.last().observer().onIceCandidate(
                new IceCandidate("candidate:2 1 udp 1 10.0.0.3 5000 typ host", "0", 0));

        assertThat(fx.manager.getCurrentCall()).get()
                .extracting(CallSession::getCallId).isEqualTo(call.getCallId());
    }

    private CallInvitation invitation(RegistryRecord callerRecord) {
        return CallInvitation.builder()
                .callId("rtc-" + callerRecord.getId())
                .channelId(CONV)
                .fromUserId(PEER)
                .fromUserName("Alex")
                .mediaKind(MediaKind.AUDIO)
                .receivedAt(fx.clock.instant())
                .registryId(callerRecord.getId())
                .source(InvitationSource.REGISTRY_RECORD)
                .build();
    }
}
