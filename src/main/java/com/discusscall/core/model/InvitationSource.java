package com.discusscall.core.model;

public enum InvitationSource {
    /** 后端显式推送的邀请 */
    EXPLICIT,
    /** 后端 "record created" 通知 */
    REGISTRY_RECORD,
    /** 普通聊天消息里的“发起通话”文案 */
    CHAT_MESSAGE
}
