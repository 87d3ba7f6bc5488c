package com.discusscall.core.rtc;

import com.discusscall.core.media.MediaTrack;
import lombok.Value;

import java.util.List;

/** 协商完成后对端的媒体流 */
@Value
public class RemoteMediaHandle {
    String id;
    List<MediaTrack> tracks;

    public boolean hasVideo() {
        return tracks.stream().anyMatch(t -> MediaTrack.KIND_VIDEO.equals(t.kind()));
    }
}
