package com.discusscall.core.model;

import lombok.Data;

/**
 * 后端推来的一条会话消息（信令信封也走这里）。
 */
@Data
public class ChatMessage {
    private long id;
    private long conversationId;

    /**
     * 作者字段原样保留：可能是数字、[id, name] 数组，
     * 也可能是 XML-RPC 片段，解析交给使用方。
     */
    private Object author;

    private String body;
    private String subject;
    private String messageType;
    private String emailFrom;
}
