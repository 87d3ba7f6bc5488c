package com.discusscall.core.signaling;

import com.discusscall.core.backend.LocalIdentityProvider;
import com.discusscall.core.config.CallProperties;
import com.discusscall.core.error.SignalingFailureException;
import com.discusscall.core.model.ChatMessage;
import com.discusscall.core.model.EnvelopeKind;
import com.discusscall.core.model.IceCandidate;
import com.discusscall.core.model.SessionDescription;
import com.discusscall.core.model.SignalingEnvelope;
import com.discusscall.core.support.FakeDiscussBackend;
import com.discusscall.core.support.MutableClock;
import com.discusscall.core.support.SignalingMessages;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignalingTransportTest {

    private static final long CONV = 7L;

    private final FakeDiscussBackend backend = new FakeDiscussBackend();
    private final SignalingEnvelopeCodec codec = new SignalingEnvelopeCodec(new ObjectMapper());
    private final CallProperties properties = new CallProperties();
    private final SignalingTransport transport = new SignalingTransport(backend, codec,
            new LocalIdentityProvider(backend), properties,
            new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));

    @Test
    void offerIsPostedAsNotificationWithSenderAndTimestamp() {
        transport.sendOffer(CONV, 42L, SessionDescription.offer("v=0"));

        assertThat(backend.postedTo(CONV)).hasSize(1);
        ChatMessage echoed = asIncoming(backend.posted.get(0).getMessage().getBody(), 1L);
        SignalingEnvelope env = codec.decode(echoed).orElseThrow();
        assertThat(env.getKind()).isEqualTo(EnvelopeKind.OFFER);
        assertThat(env.getSenderId()).isEqualTo(FakeDiscussBackend.MY_PARTNER);
        assertThat(env.getSentAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z").toEpochMilli());
    }

    @Test
    void oneFailedPostIsRetried() {
        backend.failNextPosts = 1;

        transport.sendIceCandidate(CONV, 42L, new IceCandidate("candidate:1", "0", 0));

        assertThat(backend.postedTo(CONV)).hasSize(1);
    }

    @Test
    void secondFailureSurfacesAsSignalingFailure() {
        backend.failNextPosts = 2;

        assertThatThrownBy(() -> transport.sendAnswer(CONV, 42L, SessionDescription.answer("v=0")))
                .isInstanceOf(SignalingFailureException.class);
        assertThat(backend.posted).isEmpty();
    }

    @Test
    void ownEnvelopesAreSwallowedWithoutDelivery() {
        List<SignalingEnvelope> seen = new ArrayList<>();
        transport.onEnvelope(CONV, seen::add);

        boolean consumed = transport.handleIncomingMessage(
                offerFrom(FakeDiscussBackend.MY_PARTNER, 42L));

        assertThat(consumed).isTrue();
        assertThat(seen).isEmpty();
        assertThat(transport.takeOffer(CONV, 42L)).isEmpty();
    }

    @Test
    void remoteEnvelopesReachSubscribersOfThatConversation() {
        List<SignalingEnvelope> seen = new ArrayList<>();
        List<SignalingEnvelope> elsewhere = new ArrayList<>();
        transport.onEnvelope(CONV, seen::add);
        transport.onEnvelope(CONV + 1, elsewhere::add);

        transport.handleIncomingMessage(offerFrom(99L, 42L));

        assertThat(seen).singleElement().extracting(SignalingEnvelope::getSenderId).isEqualTo(99L);
        assertThat(elsewhere).isEmpty();
    }

    @Test
    void closedSubscriptionStopsDelivery() {
        List<SignalingEnvelope> seen = new ArrayList<>();
        SignalingSubscription sub = transport.onEnvelope(CONV, seen::add);

        sub.close();
        transport.handleIncomingMessage(offerFrom(99L, 42L));

        assertThat(seen).isEmpty();
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        List<SignalingEnvelope> seen = new ArrayList<>();
        transport.onEnvelope(CONV, e -> {
            throw new IllegalStateException("boom");
        });
        transport.onEnvelope(CONV, seen::add);

        transport.handleIncomingMessage(offerFrom(99L, 42L));

        assertThat(seen).hasSize(1);
    }

    @Test
    void offersWaitInTheInboxUntilTaken() {
        transport.handleIncomingMessage(offerFrom(99L, 42L));

        assertThat(transport.takeOffer(CONV, 41L)).isEmpty();
        assertThat(transport.takeOffer(CONV, 42L)).isPresent();
        assertThat(transport.takeOffer(CONV, 42L)).isEmpty();
    }

    @Test
    void offerWithoutRegistryIdIsFoundByConversation() {
        transport.handleIncomingMessage(offerFrom(99L, 42L));

        assertThat(transport.takeOffer(CONV, null))
                .get().extracting(SignalingEnvelope::getRegistryId).isEqualTo(42L);
    }

    @Test
    void discardDropsLeftoverOffers() {
        transport.handleIncomingMessage(offerFrom(99L, 42L));

        transport.discardInbox(CONV);

        assertThat(transport.takeOffer(CONV, null)).isEmpty();
    }

    @Test
    void candidatesWithoutSubscriberWaitForTheAnsweringSide() {
        transport.handleIncomingMessage(SignalingMessages.candidate(CONV, 99L, 41L));
        transport.handleIncomingMessage(SignalingMessages.candidate(CONV, 99L, 42L));
        transport.handleIncomingMessage(SignalingMessages.candidate(CONV, 99L, 42L));

        assertThat(transport.takeCandidates(CONV, 42L))
                .hasSize(2)
                .allMatch(e -> e.getKind() == EnvelopeKind.ICE_CANDIDATE && e.getCandidate() != null);
        assertThat(transport.takeCandidates(CONV, 42L)).isEmpty();
        assertThat(transport.takeCandidates(CONV, null)).singleElement()
                .extracting(SignalingEnvelope::getRegistryId).isEqualTo(41L);
    }

    @Test
    void candidatesDeliveredToASubscriberAreNotKept() {
        List<SignalingEnvelope> seen = new ArrayList<>();
        transport.onEnvelope(CONV, seen::add);

        transport.handleIncomingMessage(SignalingMessages.candidate(CONV, 99L, 42L));

        assertThat(seen).hasSize(1);
        assertThat(transport.takeCandidates(CONV, 42L)).isEmpty();
    }

    @Test
    void candidateInboxKeepsOnlyTheNewest() {
        for (int i = 0; i < SignalingTransport.MAX_BUFFERED_CANDIDATES + 5; i++) {
            transport.handleIncomingMessage(SignalingMessages.candidate(CONV, 99L, 42L));
        }

        assertThat(transport.takeCandidates(CONV, 42L)).hasSize(SignalingTransport.MAX_BUFFERED_CANDIDATES);
    }

    @Test
    void discardAlsoDropsBufferedCandidates() {
        transport.handleIncomingMessage(SignalingMessages.candidate(CONV, 99L, 42L));

        transport.discardInbox(CONV);

        assertThat(transport.takeCandidates(CONV, null)).isEmpty();
    }

    @Test
    void ordinaryChatIsNotConsumed() {
        assertThat(transport.handleIncomingMessage(asIncoming("see you at 5", 99L))).isFalse();
    }

    private ChatMessage offerFrom(long partner, long registryId) {
        String body = "{\"type\":\"webrtc-sdp-offer\",\"sessionId\":" + registryId
                + ",\"sdp\":{\"type\":\"offer\",\"sdp\":\"v=0\"},\"timestamp\":1,\"from\":" + partner + "}";
        return asIncoming(body, partner);
    }

    private static ChatMessage asIncoming(String body, long author) {
        ChatMessage m = new ChatMessage();
        m.setId(500);
        m.setConversationId(CONV);
        m.setAuthor(author);
        m.setBody(body);
        return m;
    }
}
