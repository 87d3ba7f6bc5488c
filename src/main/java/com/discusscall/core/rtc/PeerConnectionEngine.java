package com.discusscall.core.rtc;

/**
 * 原生 WebRTC 模块的入口。运行环境里有这个 bean 才可能走 full-media 策略。
 */
public interface PeerConnectionEngine {

    PeerConnection create(RtcConfiguration configuration, PeerConnectionObserver observer);
}
