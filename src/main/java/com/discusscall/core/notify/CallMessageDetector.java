package com.discusscall.core.notify;

import com.discusscall.core.backend.DiscussMessages;
import com.discusscall.core.model.MediaKind;

import java.util.regex.Pattern;

/**
 * 从普通会话消息里认出“发起了通话”的提示。纯文本匹配，比较脆弱，
 * 只在 InvitationDispatcher 里使用，后端有结构化事件后可以整体替换。
 */
public class CallMessageDetector {

    private static final Pattern AUDIO_CALL_PAT =
            Pattern.compile("started an? (?:live )?audio call", Pattern.CASE_INSENSITIVE);
    private static final Pattern VIDEO_CALL_PAT =
            Pattern.compile("started an? (?:live )?video call", Pattern.CASE_INSENSITIVE);

    private CallMessageDetector() {
    }

    public static boolean isCallStart(String body) {
        return mediaKind(body) != null;
    }

    /** 不是通话提示时返回 null */
    public static MediaKind mediaKind(String body) {
        if (body == null || body.isEmpty()) return null;
        String text = DiscussMessages.decodeEntities(body);
        if (VIDEO_CALL_PAT.matcher(text).find()) return MediaKind.AUDIO_VIDEO;
        if (AUDIO_CALL_PAT.matcher(text).find()) return MediaKind.AUDIO;
        return null;
    }
}
