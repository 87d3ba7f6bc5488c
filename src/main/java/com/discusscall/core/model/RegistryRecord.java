package com.discusscall.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * 后端的“进行中通话”记录，其他客户端和 Web 端靠它感知响铃。
 */
@Value
@Builder
public class RegistryRecord {
    long id;
    long conversationId;

    /** 清理记录时需要 */
    long membershipId;

    long partnerId;
    String partnerName;
    SessionFlags flags;
}
