package com.discusscall.core.strategy;

import com.discusscall.core.model.CallStrategyType;
import com.discusscall.core.model.MediaKind;

import java.time.Instant;

/**
 * callId 的生成规则，id 本身能看出是哪个档位、哪条 registry 记录产生的：
 * - 通话：{tag}-{registryId}-{epochMillis}，没有记录时 registryId 写 none
 * - registry 记录来电：rtc-{recordId}
 * - 聊天消息来电：incoming-{audio|video}-{channelId}-{epochMillis}
 */
public final class CallIdFormat {

    private CallIdFormat() {
    }

    public static String format(CallStrategyType strategy, Long registryId, Instant at) {
        return strategy.tag() + "-" + (registryId == null ? "none" : registryId) + "-" + at.toEpochMilli();
    }

    public static String registryInvitation(long recordId) {
        return "rtc-" + recordId;
    }

    public static String chatInvitation(MediaKind kind, long channelId, Instant at) {
        return "incoming-" + kind.label() + "-" + channelId + "-" + at.toEpochMilli();
    }

    /** 从 callId 反推档位，不认识的前缀返回 null */
    public static CallStrategyType strategyOf(String callId) {
        if (callId == null) return null;
        for (CallStrategyType t : CallStrategyType.values()) {
            if (callId.startsWith(t.tag() + "-")) {
                return t;
            }
        }
        return null;
    }
}
