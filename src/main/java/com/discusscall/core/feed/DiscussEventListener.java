package com.discusscall.core.feed;

import com.discusscall.core.model.BackendNotification;
import com.discusscall.core.model.ChatMessage;

/**
 * 事件通道的回调。两个方法都在轮询线程上调用，实现里不要长时间阻塞。
 */
public interface DiscussEventListener {

    void onNotification(BackendNotification notification);

    void onNewMessage(ChatMessage message);
}
