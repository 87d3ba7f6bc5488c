package com.discusscall.core.rtc;

import com.discusscall.core.model.IceCandidate;

/**
 * peer connection 的回调，可能在引擎自己的线程上触发。
 */
public interface PeerConnectionObserver {

    void onIceCandidate(IceCandidate candidate);

    void onRemoteMedia(RemoteMediaHandle media);

    void onConnectionStateChange(PeerConnectionState state);
}
