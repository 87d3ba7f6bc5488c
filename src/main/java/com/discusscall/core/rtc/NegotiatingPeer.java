package com.discusscall.core.rtc;

import com.discusscall.core.media.LocalMediaHandle;
import com.discusscall.core.model.IceCandidate;
import com.discusscall.core.model.MediaKind;
import com.discusscall.core.model.SessionDescription;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 在 PeerConnection 外面包一层协商逻辑。
 *
 * 信令信封可能乱序到达：remote description 还没设置时收到的 ICE candidate 先缓存，
 * 设置 remote description 之后按到达顺序补上。
 */
@Slf4j
public class NegotiatingPeer {

    private final PeerConnection connection;
    private final List<IceCandidate> pendingCandidates = new ArrayList<>();
    private boolean closed;

    public NegotiatingPeer(PeerConnection connection) {
        this.connection = connection;
    }

    public synchronized void attach(LocalMediaHandle media) {
        media.getTracks().forEach(connection::addTrack);
    }

    public synchronized SessionDescription createOffer(MediaKind kind) {
        SessionDescription offer = connection.createOffer(kind);
        connection.setLocalDescription(offer);
        return offer;
    }

    /** 作为被叫：应用对端 offer 并生成 answer */
    public synchronized SessionDescription acceptOffer(SessionDescription offer) {
        applyRemote(offer);
        SessionDescription answer = connection.createAnswer();
        connection.setLocalDescription(answer);
        return answer;
    }

    /** 作为主叫：应用对端 answer */
    public synchronized void acceptAnswer(SessionDescription answer) {
        applyRemote(answer);
    }

    public synchronized void addRemoteCandidate(IceCandidate candidate) {
        if (closed) return;
        if (!connection.hasRemoteDescription()) {
            pendingCandidates.add(candidate);
            log.debug("Buffered ICE candidate, {} pending", pendingCandidates.size());
            return;
        }
        apply(candidate);
    }

    public synchronized int pendingCandidateCount() {
        return pendingCandidates.size();
    }

    public synchronized boolean hasRemoteDescription() {
        return connection.hasRemoteDescription();
    }

    public PeerConnectionState state() {
        return connection.state();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized void close() {
        if (closed) return;
        closed = true;
        pendingCandidates.clear();
        connection.close();
    }

    private void applyRemote(SessionDescription description) {
        if (closed) {
            throw new IllegalStateException("peer already closed");
        }
        connection.setRemoteDescription(description);
        if (!pendingCandidates.isEmpty()) {
            log.debug("Draining {} buffered ICE candidate(s)", pendingCandidates.size());
            List<IceCandidate> drain = new ArrayList<>(pendingCandidates);
            pendingCandidates.clear();
            drain.forEach(this::apply);
        }
    }

    private void apply(IceCandidate candidate) {
        try {
            connection.addIceCandidate(candidate);
        } catch (RuntimeException e) {
            // 单个坏 candidate 不影响其他路径
            log.warn("Dropping ICE candidate {}: {}", candidate.getCandidate(), e.getMessage());
        }
    }
}
