package com.discusscall.core.feed;

import java.util.Set;

/**
 * 后端事件通道：按会话订阅，推送 record-* 通知和新消息。
 */
public interface DiscussEventFeed {

    void subscribe(long conversationId);

    void unsubscribe(long conversationId);

    Set<Long> subscriptions();

    void addListener(DiscussEventListener listener);
}
