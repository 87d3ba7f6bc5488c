package com.discusscall.core.media;

/**
 * 一条本地或远端的媒体轨道，由平台实现提供。
 */
public interface MediaTrack {

    String KIND_AUDIO = "audio";
    String KIND_VIDEO = "video";

    String id();

    /** audio / video */
    String kind();

    boolean isEnabled();

    void setEnabled(boolean enabled);

    /** 释放底层设备，重复调用无副作用 */
    void stop();
}
