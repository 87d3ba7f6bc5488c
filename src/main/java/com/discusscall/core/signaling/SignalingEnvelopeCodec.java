package com.discusscall.core.signaling;

import com.discusscall.core.backend.DiscussMessages;
import com.discusscall.core.error.SignalingFailureException;
import com.discusscall.core.model.ChatMessage;
import com.discusscall.core.model.EnvelopeKind;
import com.discusscall.core.model.IceCandidate;
import com.discusscall.core.model.OutgoingMessage;
import com.discusscall.core.model.SessionDescription;
import com.discusscall.core.model.SignalingEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 信令信封和会话消息之间的编解码。
 *
 * 线上格式与 Web 端一致：subject 为 "WebRTC SDP Offer" 等，message_type=notification，
 * body 是 JSON：
 * {"type":"webrtc-sdp-offer","sessionId":42,"sdp":{"type":"offer","sdp":"..."},
 *  "candidate":{"candidate":"...","sdpMid":"0","sdpMLineIndex":0},"timestamp":...,"from":99}
 *
 * 解码尽量宽松：后端会把 body 包进 &lt;p&gt; 并转义引号，不是信封的消息返回 empty。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SignalingEnvelopeCodec {

    private static final String TYPE_PREFIX = "webrtc-";

    private final ObjectMapper objectMapper;

    public OutgoingMessage encode(SignalingEnvelope envelope) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("type", envelope.getKind().wireType());
        if (envelope.getRegistryId() != null) {
            root.put("sessionId", envelope.getRegistryId());
        } else {
            root.putNull("sessionId");
        }
        if (envelope.getDescription() != null) {
            ObjectNode sdp = root.putObject("sdp");
            sdp.put("type", envelope.getDescription().getType());
            sdp.put("sdp", envelope.getDescription().getSdp());
        }
        if (envelope.getCandidate() != null) {
            IceCandidate c = envelope.getCandidate();
            ObjectNode cand = root.putObject("candidate");
            cand.put("candidate", c.getCandidate());
            cand.put("sdpMid", c.getSdpMid());
            if (c.getSdpMLineIndex() != null) {
                cand.put("sdpMLineIndex", c.getSdpMLineIndex());
            }
        }
        root.put("timestamp", envelope.getSentAt());
        if (envelope.getSenderId() != null) {
            root.put("from", envelope.getSenderId());
        }

        try {
            return OutgoingMessage.builder()
                    .body(objectMapper.writeValueAsString(root))
                    .subject(envelope.getKind().subject())
                    .messageType(OutgoingMessage.TYPE_NOTIFICATION)
                    .build();
        } catch (JsonProcessingException e) {
            throw new SignalingFailureException("could not encode " + envelope.getKind() + " envelope", e);
        }
    }

    public Optional<SignalingEnvelope> decode(ChatMessage message) {
        if (message == null || message.getBody() == null) {
            return Optional.empty();
        }
        String text = DiscussMessages.decodeEntities(message.getBody());
        if (!text.contains(TYPE_PREFIX)) {
            return Optional.empty();
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(text.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            log.debug("Message {} mentions webrtc but is not JSON: {}", message.getId(), e.getOriginalMessage());
            return Optional.empty();
        }

        EnvelopeKind kind = EnvelopeKind.fromWireType(root.path("type").asText(null));
        if (kind == null) {
            return Optional.empty();
        }

        SessionDescription description = null;
        JsonNode sdp = root.get("sdp");
        if (sdp != null && sdp.isObject() && sdp.hasNonNull("sdp")) {
            String type = sdp.path("type").asText(kind == EnvelopeKind.ANSWER ? "answer" : "offer");
            description = new SessionDescription(type, sdp.get("sdp").asText());
        }

        IceCandidate candidate = null;
        JsonNode cand = root.get("candidate");
        if (cand != null && cand.isObject() && cand.hasNonNull("candidate")) {
            candidate = new IceCandidate(
                    cand.get("candidate").asText(),
                    cand.hasNonNull("sdpMid") ? cand.get("sdpMid").asText() : null,
                    cand.hasNonNull("sdpMLineIndex") ? cand.get("sdpMLineIndex").asInt() : null);
        }

        if (kind == EnvelopeKind.ICE_CANDIDATE ? candidate == null : description == null) {
            log.debug("Dropping {} envelope without payload, message={}", kind, message.getId());
            return Optional.empty();
        }

        Long sender = root.hasNonNull("from") && root.get("from").canConvertToLong()
                ? Long.valueOf(root.get("from").asLong())
                : DiscussMessages.authorId(message.getAuthor());

        return Optional.of(SignalingEnvelope.builder()
                .kind(kind)
                .conversationId(message.getConversationId())
                .registryId(root.hasNonNull("sessionId") && root.get("sessionId").canConvertToLong()
                        ? root.get("sessionId").asLong() : null)
                .description(description)
                .candidate(candidate)
                .sentAt(root.path("timestamp").asLong(0L))
                .senderId(sender)
                .build());
    }
}
