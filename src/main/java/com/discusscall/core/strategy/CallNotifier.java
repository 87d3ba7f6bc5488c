package com.discusscall.core.strategy;

import com.discusscall.core.backend.DiscussBackend;
import com.discusscall.core.model.MediaKind;
import com.discusscall.core.model.OutgoingMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 会话里给人看的通话提示消息。发送失败只记日志。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CallNotifier {

    private final DiscussBackend backend;

    public void callStarted(long conversationId, String callerName, MediaKind kind) {
        String body = kind.isVideo()
                ? "📹 " + callerName + " started a video call"
                : "🎤 " + callerName + " started an audio call";
        post(conversationId, body);
    }

    public void callAnswered(long conversationId, String name) {
        post(conversationId, "📞 Call answered by " + name);
    }

    public void callEnded(long conversationId, String name) {
        post(conversationId, "📞 Call ended by " + name);
    }

    private void post(long conversationId, String body) {
        try {
            backend.postMessage(conversationId, OutgoingMessage.comment(body));
        } catch (RuntimeException e) {
            log.warn("Could not post call notice to conversation {}: {}", conversationId, e.getMessage());
        }
    }
}
