package com.discusscall.core.rtc;

import com.discusscall.core.media.MediaTrack;
import com.discusscall.core.model.IceCandidate;
import com.discusscall.core.model.MediaKind;
import com.discusscall.core.model.SessionDescription;

/**
 * 原生 peer connection 的最小抽象。方法都是同步的，引擎实现负责把异步 API 包装起来。
 */
public interface PeerConnection {

    void addTrack(MediaTrack track);

    /** offerToReceiveAudio 恒为 true，offerToReceiveVideo 跟随 kind */
    SessionDescription createOffer(MediaKind kind);

    SessionDescription createAnswer();

    void setLocalDescription(SessionDescription description);

    void setRemoteDescription(SessionDescription description);

    boolean hasRemoteDescription();

    void addIceCandidate(IceCandidate candidate);

    PeerConnectionState state();

    void close();
}
