package com.discusscall.core.backend;

import com.discusscall.core.model.ChatMessage;
import com.discusscall.core.model.ConversationInfo;
import com.discusscall.core.model.LocalIdentity;
import com.discusscall.core.model.OutgoingMessage;
import com.discusscall.core.model.RegistryRecord;
import com.discusscall.core.model.SessionFlags;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * DiscussBackend 的 Odoo 实现。
 *
 * 模型对应关系：
 * - res.users                   : 当前用户（uid / partner_id / name）
 * - discuss.channel             : 会话，message_post 发消息
 * - discuss.channel.member      : 会话成员
 * - discuss.channel.rtc.session : “进行中通话”记录
 * - mail.message                : 新消息轮询
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OdooDiscussBackend implements DiscussBackend {

    static final String USERS = "res.users";
    static final String CHANNEL = "discuss.channel";
    static final String MEMBER = "discuss.channel.member";
    static final String RTC_SESSION = "discuss.channel.rtc.session";
    static final String MESSAGE = "mail.message";

    private static final List<String> RTC_FIELDS = List.of(
            "id", "channel_id", "channel_member_id", "partner_id",
            "is_muted", "is_camera_on", "is_screen_sharing_on");

    private final OdooRpcClient client;

    @Override
    public LocalIdentity currentIdentity() {
        long uid = client.uid();
        JsonNode rows = client.executeKw(USERS, "read", List.of(List.of(uid)),
                Map.of("fields", List.of("partner_id", "name")));
        JsonNode user = first(rows)
                .orElseThrow(() -> new OdooRpcException("User " + uid + " not readable"));
        Long partnerId = OdooValues.many2oneId(user.get("partner_id"));
        if (partnerId == null) {
            throw new OdooRpcException("User " + uid + " has no partner");
        }
        return new LocalIdentity(uid, partnerId, user.path("name").asText("Mobile User"));
    }

    @Override
    public ConversationInfo readConversation(long conversationId) {
        JsonNode rows = client.executeKw(CHANNEL, "read", List.of(List.of(conversationId)),
                Map.of("fields", List.of("id", "name", "channel_type")));
        JsonNode channel = first(rows)
                .orElseThrow(() -> new OdooRpcException("Channel " + conversationId + " not readable"));
        return new ConversationInfo(
                conversationId,
                channel.path("name").asText(""),
                "chat".equals(channel.path("channel_type").asText()));
    }

    @Override
    public Optional<Long> findMembership(long conversationId, long partnerId) {
        List<Object> domain = List.of(
                List.of("channel_id", "=", conversationId),
                List.of("partner_id", "=", partnerId));
        JsonNode rows = client.executeKw(MEMBER, "search_read", List.of(domain),
                Map.of("fields", List.of("id"), "limit", 1));
        return first(rows).map(r -> r.path("id").asLong());
    }

    @Override
    public long createMembership(long conversationId, long partnerId) {
        Map<String, Object> values = Map.of("channel_id", conversationId, "partner_id", partnerId);
        return client.executeKw(MEMBER, "create", List.of(values), Map.of()).asLong();
    }

    @Override
    public long createRtcSession(long conversationId, long membershipId, long partnerId, SessionFlags flags) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("channel_id", conversationId);
        values.put("channel_member_id", membershipId);
        values.put("partner_id", partnerId);
        values.put("is_camera_on", Boolean.TRUE.equals(flags.getCameraOn()));
        values.put("is_muted", Boolean.TRUE.equals(flags.getMuted()));
        values.put("is_screen_sharing_on", Boolean.TRUE.equals(flags.getScreenSharing()));
        values.put("is_deaf", false);
        return client.executeKw(RTC_SESSION, "create", List.of(values), Map.of()).asLong();
    }

    @Override
    public List<RegistryRecord> searchRtcSessions(Long conversationId, Long partnerId) {
        List<Object> domain = new ArrayList<>();
        if (conversationId != null) {
            domain.add(List.of("channel_id", "=", conversationId));
        }
        if (partnerId != null) {
            domain.add(List.of("partner_id", "=", partnerId));
        }
        JsonNode rows = client.executeKw(RTC_SESSION, "search_read", List.of(domain),
                Map.of("fields", RTC_FIELDS));
        List<RegistryRecord> result = new ArrayList<>();
        for (JsonNode row : rows) {
            result.add(toRecord(row));
        }
        return result;
    }

    @Override
    public Optional<RegistryRecord> readRtcSession(long recordId) {
        // search_read 而不是 read：记录已删除时 read 会报 MissingError
        JsonNode rows = client.executeKw(RTC_SESSION, "search_read",
                List.of(List.of(List.of("id", "=", recordId))),
                Map.of("fields", RTC_FIELDS, "limit", 1));
        return first(rows).map(this::toRecord);
    }

    @Override
    public void deleteRtcSessions(List<Long> recordIds) {
        if (recordIds.isEmpty()) return;
        client.executeKw(RTC_SESSION, "unlink", List.of(recordIds), Map.of());
    }

    @Override
    public void updateRtcSession(long recordId, SessionFlags flags) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (flags.getMuted() != null) values.put("is_muted", flags.getMuted());
        if (flags.getCameraOn() != null) values.put("is_camera_on", flags.getCameraOn());
        if (flags.getScreenSharing() != null) values.put("is_screen_sharing_on", flags.getScreenSharing());
        if (values.isEmpty()) return;
        client.executeKw(RTC_SESSION, "write", List.of(List.of(recordId), values), Map.of());
    }

    @Override
    public long postMessage(long conversationId, OutgoingMessage message) {
        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put("body", message.getBody());
        kwargs.put("message_type", message.getMessageType());
        if (message.getSubject() != null) {
            kwargs.put("subject", message.getSubject());
        }
        kwargs.put("subtype_xmlid", "mail.mt_comment");
        JsonNode result = client.executeKw(CHANNEL, "message_post", List.of(List.of(conversationId)), kwargs);
        return result.isIntegralNumber() ? result.asLong() : 0L;
    }

    @Override
    public List<ChatMessage> fetchMessagesAfter(long conversationId, long afterMessageId, int limit) {
        List<Object> domain = List.of(
                List.of("model", "=", CHANNEL),
                List.of("res_id", "=", conversationId),
                List.of("id", ">", afterMessageId));
        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put("fields", List.of("id", "body", "author_id", "message_type", "subject", "email_from"));
        kwargs.put("limit", limit);
        kwargs.put("order", "id asc");
        JsonNode rows = client.executeKw(MESSAGE, "search_read", List.of(domain), kwargs);

        List<ChatMessage> result = new ArrayList<>();
        for (JsonNode row : rows) {
            ChatMessage m = new ChatMessage();
            m.setId(row.path("id").asLong());
            m.setConversationId(conversationId);
            m.setAuthor(OdooValues.toPlain(row.get("author_id")));
            m.setBody(OdooValues.text(row.get("body")));
            m.setSubject(OdooValues.text(row.get("subject")));
            m.setMessageType(OdooValues.text(row.get("message_type")));
            m.setEmailFrom(OdooValues.text(row.get("email_from")));
            result.add(m);
        }
        return result;
    }

    @Override
    public long latestMessageId(long conversationId) {
        List<Object> domain = List.of(
                List.of("model", "=", CHANNEL),
                List.of("res_id", "=", conversationId));
        JsonNode rows = client.executeKw(MESSAGE, "search_read", List.of(domain),
                Map.of("fields", List.of("id"), "limit", 1, "order", "id desc"));
        return first(rows).map(r -> r.path("id").asLong()).orElse(0L);
    }

    private RegistryRecord toRecord(JsonNode row) {
        Long channelId = OdooValues.many2oneId(row.get("channel_id"));
        Long memberId = OdooValues.many2oneId(row.get("channel_member_id"));
        Long partnerId = OdooValues.many2oneId(row.get("partner_id"));
        return RegistryRecord.builder()
                .id(row.path("id").asLong())
                .conversationId(channelId == null ? 0L : channelId)
                .membershipId(memberId == null ? 0L : memberId)
                .partnerId(partnerId == null ? 0L : partnerId)
                .partnerName(OdooValues.many2oneName(row.get("partner_id")))
                .flags(SessionFlags.builder()
                        .muted(row.path("is_muted").asBoolean(false))
                        .cameraOn(row.path("is_camera_on").asBoolean(false))
                        .screenSharing(row.path("is_screen_sharing_on").asBoolean(false))
                        .build())
                .build();
    }

    private static Optional<JsonNode> first(JsonNode rows) {
        if (rows == null || !rows.isArray() || rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(rows.get(0));
    }
}
