package com.discusscall.core.support;

import com.discusscall.core.media.MediaTrack;
import com.discusscall.core.model.IceCandidate;
import com.discusscall.core.model.MediaKind;
import com.discusscall.core.model.SessionDescription;
import com.discusscall.core.rtc.PeerConnection;
import com.discusscall.core.rtc.PeerConnectionEngine;
import com.discusscall.core.rtc.PeerConnectionObserver;
import com.discusscall.core.rtc.PeerConnectionState;
import com.discusscall.core.rtc.RtcConfiguration;

import java.util.ArrayList;
import java.util.List;

/**
 * 假的 WebRTC 引擎。行为尽量贴近真实实现：
 * - 没有 remote description 时 addIceCandidate 直接抛异常；
 * - setLocalDescription 后立即产生一个本地 host candidate；
 * - remote description 已设置且至少应用过一个 candidate 时变为 CONNECTED。
 */
public class FakePeerConnectionEngine implements PeerConnectionEngine {

    public final List<FakePeerConnection> created = new ArrayList<>();
    public RtcConfiguration lastConfiguration;
    public boolean failCreate;

    @Override
    public PeerConnection create(RtcConfiguration configuration, PeerConnectionObserver observer) {
        if (failCreate) {
            throw new IllegalStateException("native module missing");
        }
        lastConfiguration = configuration;
        FakePeerConnection pc = new FakePeerConnection(observer);
        created.add(pc);
        return pc;
    }

    public FakePeerConnection last() {
        return created.get(created.size() - 1);
    }

    public static class FakePeerConnection implements PeerConnection {

        private final PeerConnectionObserver observer;
        public final List<MediaTrack> tracks = new ArrayList<>();
        public final List<IceCandidate> applied = new ArrayList<>();
        public SessionDescription local;
        public SessionDescription remote;
        public boolean emitLocalCandidates = true;
        private PeerConnectionState state = PeerConnectionState.NEW;

        FakePeerConnection(PeerConnectionObserver observer) {
            this.observer = observer;
        }

        @Override
        public void addTrack(MediaTrack track) {
            tracks.add(track);
        }

        @Override
        public SessionDescription createOffer(MediaKind kind) {
            return SessionDescription.offer("v=0\r\nm=audio 9 RTP/SAVPF 111\r\n"
                    + (kind.isVideo() ? "m=video 9 RTP/SAVPF 96\r\n" : ""));
        }

        @Override
        public SessionDescription createAnswer() {
            if (remote == null) {
                throw new IllegalStateException("no remote offer");
            }
            return SessionDescription.answer("v=0\r\nm=audio 9 RTP/SAVPF 111\r\n");
        }

        @Override
        public void setLocalDescription(SessionDescription description) {
            local = description;
            state = PeerConnectionState.CONNECTING;
            if (emitLocalCandidates) {
                observer.onIceCandidate(new IceCandidate(
                        "candidate:1 1 udp 2122260223 192.168.1.20 54321 typ host", "0", 0));
            }
        }

        @Override
        public void setRemoteDescription(SessionDescription description) {
            remote = description;
            maybeConnect();
        }

        @Override
        public boolean hasRemoteDescription() {
            return remote != null;
        }

        @Override
        public void addIceCandidate(IceCandidate candidate) {
            if (remote == null) {
                throw new IllegalStateException("remote description not set");
            }
            applied.add(candidate);
            maybeConnect();
        }

        @Override
        public PeerConnectionState state() {
            return state;
        }

        @Override
        public void close() {
            state = PeerConnectionState.CLOSED;
        }

        public void fail() {
            state = PeerConnectionState.FAILED;
            observer.onConnectionStateChange(state);
        }

        public PeerConnectionObserver observer() {
            return observer;
        }

        private void maybeConnect() {
            if (state != PeerConnectionState.CONNECTED && state != PeerConnectionState.CLOSED
                    && remote != null && !applied.isEmpty()) {
                state = PeerConnectionState.CONNECTED;
                observer.onConnectionStateChange(state);
            }
        }
    }
}
