package com.discusscall.core.backend;

import com.discusscall.core.model.ChatMessage;
import com.discusscall.core.model.ConversationInfo;
import com.discusscall.core.model.LocalIdentity;
import com.discusscall.core.model.OutgoingMessage;
import com.discusscall.core.model.RegistryRecord;
import com.discusscall.core.model.SessionFlags;

import java.util.List;
import java.util.Optional;

/**
 * 通话核心对后端的全部依赖：用户身份、会话成员、会话消息、“进行中通话”记录。
 * 后端本身不是实时信令服务器，这里只暴露 RPC 风格的增删改查。
 *
 * 实现失败时抛 {@link OdooRpcException}，由上层转换成通话领域的异常。
 */
public interface DiscussBackend {

    LocalIdentity currentIdentity();

    ConversationInfo readConversation(long conversationId);

    Optional<Long> findMembership(long conversationId, long partnerId);

    long createMembership(long conversationId, long partnerId);

    long createRtcSession(long conversationId, long membershipId, long partnerId, SessionFlags flags);

    /**
     * @param conversationId 为 null 时不按会话过滤
     * @param partnerId      为 null 时不按成员过滤
     */
    List<RegistryRecord> searchRtcSessions(Long conversationId, Long partnerId);

    Optional<RegistryRecord> readRtcSession(long recordId);

    void deleteRtcSessions(List<Long> recordIds);

    void updateRtcSession(long recordId, SessionFlags flags);

    /** 普通会话消息通道：通话提示和信令信封都走这里 */
    long postMessage(long conversationId, OutgoingMessage message);

    List<ChatMessage> fetchMessagesAfter(long conversationId, long afterMessageId, int limit);

    long latestMessageId(long conversationId);
}
