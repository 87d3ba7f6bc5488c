package com.discusscall.core.error;

/**
 * 当前用户在会话里找不到 membership。不允许退化成“借用”其他成员的记录。
 */
public class NoMembershipException extends CallException {

    public NoMembershipException(long conversationId, long partnerId) {
        super(CallErrorType.NO_MEMBERSHIP,
                "partner " + partnerId + " is not a member of conversation " + conversationId);
    }
}
