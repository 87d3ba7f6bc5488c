package com.discusscall.core.media;

import com.discusscall.core.config.CallProperties;
import com.discusscall.core.model.MediaKind;
import lombok.Builder;
import lombok.Value;

/**
 * 通话场景的采集参数：回声消除、降噪、自动增益始终打开，单声道 48kHz。
 */
@Value
@Builder
public class MediaConstraints {
    boolean audio;
    boolean echoCancellation;
    boolean noiseSuppression;
    boolean autoGainControl;
    int sampleRate;
    int channelCount;

    boolean video;
    int videoWidth;
    int videoHeight;
    int frameRate;

    public static MediaConstraints forCall(MediaKind kind, CallProperties.Media media) {
        MediaConstraintsBuilder b = MediaConstraints.builder()
                .audio(true)
                .echoCancellation(true)
                .noiseSuppression(true)
                .autoGainControl(true)
                .sampleRate(media.getSampleRate())
                .channelCount(media.getChannelCount())
                .video(kind.isVideo());
        if (kind.isVideo()) {
            b.videoWidth(media.getVideoWidth())
                    .videoHeight(media.getVideoHeight())
                    .frameRate(media.getFrameRate());
        }
        return b.build();
    }
}
