package com.discusscall.core.model;

/**
 * 通话媒体类型：纯音频 / 音频+视频。
 */
public enum MediaKind {
    AUDIO,
    AUDIO_VIDEO;

    public boolean isVideo() {
        return this == AUDIO_VIDEO;
    }

    /** 消息文案、日志里使用的短名称 */
    public String label() {
        return isVideo() ? "video" : "audio";
    }

    public static MediaKind fromVideoFlag(boolean video) {
        return video ? AUDIO_VIDEO : AUDIO;
    }
}
