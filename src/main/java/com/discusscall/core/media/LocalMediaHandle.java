package com.discusscall.core.media;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 本地采集句柄：一次通话拿到的全部本地轨道。
 * stop() 幂等，通话拆除和取消采集都会调到这里。
 */
@Slf4j
public class LocalMediaHandle {

    private final List<MediaTrack> tracks;
    private volatile boolean stopped;

    public LocalMediaHandle(List<MediaTrack> tracks) {
        this.tracks = List.copyOf(tracks);
    }

    public List<MediaTrack> getTracks() {
        return tracks;
    }

    public List<MediaTrack> audioTracks() {
        return tracks.stream().filter(t -> MediaTrack.KIND_AUDIO.equals(t.kind())).toList();
    }

    public List<MediaTrack> videoTracks() {
        return tracks.stream().filter(t -> MediaTrack.KIND_VIDEO.equals(t.kind())).toList();
    }

    public boolean isStopped() {
        return stopped;
    }

    public synchronized void stop() {
        if (stopped) return;
        stopped = true;
        for (MediaTrack t : tracks) {
            try {
                t.stop();
            } catch (RuntimeException e) {
                log.warn("Failed to stop {} track {}: {}", t.kind(), t.id(), e.getMessage());
            }
        }
    }
}
