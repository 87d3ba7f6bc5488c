package com.discusscall.core.signaling;

import com.discusscall.core.backend.DiscussBackend;
import com.discusscall.core.backend.LocalIdentityProvider;
import com.discusscall.core.config.CallProperties;
import com.discusscall.core.error.SignalingFailureException;
import com.discusscall.core.model.ChatMessage;
import com.discusscall.core.model.EnvelopeKind;
import com.discusscall.core.model.IceCandidate;
import com.discusscall.core.model.LocalIdentity;
import com.discusscall.core.model.OutgoingMessage;
import com.discusscall.core.model.SessionDescription;
import com.discusscall.core.model.SignalingEnvelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 借会话消息通道传输 offer / answer / ICE candidate。
 *
 * 每一跳信令都是会话里的一条消息，聊天界面需要自己把这些消息过滤掉，
 * 会话消息量也会因此增加。
 *
 * 发送失败最多重试 signaling-retry-attempts 次，仍失败抛 SignalingFailureException。
 * 收到的 offer 会留在收件箱里，接听时还没订阅也不会丢。
 * 没有订阅者时到达的 ICE candidate 同样暂存（每个 registry 记录最多 MAX_BUFFERED_CANDIDATES 个），
 * 接听后一次取走。
 */
@Service
@Slf4j
public class SignalingTransport {

    static final int MAX_BUFFERED_CANDIDATES = 64;

    private final DiscussBackend backend;
    private final SignalingEnvelopeCodec codec;
    private final LocalIdentityProvider identityProvider;
    private final CallProperties properties;
    private final Clock clock;

    private final Map<Long, List<Consumer<SignalingEnvelope>>> listeners = new ConcurrentHashMap<>();
    private final Map<String, SignalingEnvelope> offerInbox = new ConcurrentHashMap<>();
    private final Map<String, Deque<SignalingEnvelope>> candidateInbox = new ConcurrentHashMap<>();

    public SignalingTransport(DiscussBackend backend,
                              SignalingEnvelopeCodec codec,
                              LocalIdentityProvider identityProvider,
                              CallProperties properties,
                              Clock clock) {
        this.backend = backend;
        this.codec = codec;
        this.identityProvider = identityProvider;
        this.properties = properties;
        this.clock = clock;
    }

    public void sendOffer(long conversationId, Long registryId, SessionDescription description) {
        send(envelope(EnvelopeKind.OFFER, conversationId, registryId).description(description).build());
    }

    public void sendAnswer(long conversationId, Long registryId, SessionDescription description) {
        send(envelope(EnvelopeKind.ANSWER, conversationId, registryId).description(description).build());
    }

    public void sendIceCandidate(long conversationId, Long registryId, IceCandidate candidate) {
        send(envelope(EnvelopeKind.ICE_CANDIDATE, conversationId, registryId).candidate(candidate).build());
    }

    public SignalingSubscription onEnvelope(long conversationId, Consumer<SignalingEnvelope> listener) {
        listeners.computeIfAbsent(conversationId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> {
            List<Consumer<SignalingEnvelope>> ls = listeners.get(conversationId);
            if (ls != null) {
                ls.remove(listener);
            }
        };
    }

    /**
     * 事件通道上的新消息先交给这里。
     *
     * @return true 表示消息是信令信封（包括本端自己发出的），调用方不应再按普通消息处理
     */
    public boolean handleIncomingMessage(ChatMessage message) {
        Optional<SignalingEnvelope> decoded = codec.decode(message);
        if (decoded.isEmpty()) {
            return false;
        }
        SignalingEnvelope env = decoded.get();
        Long self = identityProvider.tryGet().map(LocalIdentity::getPartnerId).orElse(null);
        if (self != null && self.equals(env.getSenderId())) {
            log.trace("Ignoring own {} envelope, message={}", env.getKind(), message.getId());
            return true;
        }

        log.debug("Received {} envelope: conversation={}, registryId={}",
                env.getKind(), env.getConversationId(), env.getRegistryId());
        if (env.getKind() == EnvelopeKind.OFFER) {
            offerInbox.put(inboxKey(env.getConversationId(), env.getRegistryId()), env);
        }

        List<Consumer<SignalingEnvelope>> ls = listeners.getOrDefault(env.getConversationId(), List.of());
        if (env.getKind() == EnvelopeKind.ICE_CANDIDATE && ls.isEmpty()) {
            bufferCandidate(env);
        }
        for (Consumer<SignalingEnvelope> l : ls) {
            try {
                l.accept(env);
            } catch (RuntimeException e) {
                log.error("Signaling listener failed on {} envelope", env.getKind(), e);
            }
        }
        return true;
    }

    /**
     * 取走某个会话里尚未处理的 offer。registryId 为 null 时取该会话任意一个。
     */
    public Optional<SignalingEnvelope> takeOffer(long conversationId, Long registryId) {
        SignalingEnvelope exact = offerInbox.remove(inboxKey(conversationId, registryId));
        if (exact != null || registryId != null) {
            return Optional.ofNullable(exact);
        }
        String prefix = conversationId + ":";
        for (String key : offerInbox.keySet()) {
            if (key.startsWith(prefix)) {
                return Optional.ofNullable(offerInbox.remove(key));
            }
        }
        return Optional.empty();
    }

    /**
     * 取走还没人订阅时暂存的 ICE candidate。
     * registryId 为 null 时取该会话全部；否则取这条记录的，加上没带 sessionId 的。
     */
    public List<SignalingEnvelope> takeCandidates(long conversationId, Long registryId) {
        List<SignalingEnvelope> taken = new ArrayList<>();
        if (registryId == null) {
            String prefix = conversationId + ":";
            for (String key : candidateInbox.keySet()) {
                if (key.startsWith(prefix)) {
                    drainInto(candidateInbox.remove(key), taken);
                }
            }
        } else {
            drainInto(candidateInbox.remove(inboxKey(conversationId, registryId)), taken);
            drainInto(candidateInbox.remove(inboxKey(conversationId, null)), taken);
        }
        return taken;
    }

    /** 通话结束后丢掉这个会话里残留的 offer 和 candidate */
    public void discardInbox(long conversationId) {
        String prefix = conversationId + ":";
        offerInbox.keySet().removeIf(k -> k.startsWith(prefix));
        candidateInbox.keySet().removeIf(k -> k.startsWith(prefix));
    }

    private void bufferCandidate(SignalingEnvelope env) {
        candidateInbox.compute(inboxKey(env.getConversationId(), env.getRegistryId()), (k, queue) -> {
            Deque<SignalingEnvelope> q = queue == null ? new ArrayDeque<>() : queue;
            if (q.size() >= MAX_BUFFERED_CANDIDATES) {
                q.pollFirst();
                log.debug("Candidate inbox {} full, dropped the oldest", k);
            }
            q.addLast(env);
            return q;
        });
    }

    private static void drainInto(Deque<SignalingEnvelope> queue, List<SignalingEnvelope> target) {
        if (queue != null) {
            target.addAll(queue);
        }
    }

    private SignalingEnvelope.SignalingEnvelopeBuilder envelope(EnvelopeKind kind, long conversationId, Long registryId) {
        return SignalingEnvelope.builder()
                .kind(kind)
                .conversationId(conversationId)
                .registryId(registryId)
                .sentAt(clock.millis())
                .senderId(identityProvider.tryGet().map(LocalIdentity::getPartnerId).orElse(null));
    }

    private void send(SignalingEnvelope env) {
        OutgoingMessage message = codec.encode(env);
        int attempts = 1 + Math.max(0, properties.getSignalingRetryAttempts());
        RuntimeException last = null;
        for (int i = 1; i <= attempts; i++) {
            try {
                backend.postMessage(env.getConversationId(), message);
                log.debug("Sent {} envelope to conversation {} (attempt {})", env.getKind(), env.getConversationId(), i);
                return;
            } catch (RuntimeException e) {
                last = e;
                log.warn("Sending {} envelope failed (attempt {}/{}): {}", env.getKind(), i, attempts, e.getMessage());
            }
        }
        throw new SignalingFailureException("could not send " + env.getKind() + " envelope", last);
    }

    private static String inboxKey(long conversationId, Long registryId) {
        return conversationId + ":" + Objects.toString(registryId, "none");
    }
}
