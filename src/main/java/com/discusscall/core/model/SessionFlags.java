package com.discusscall.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * registry 记录上的开关位。字段为 null 表示“不修改”，用于部分更新。
 */
@Value
@Builder
public class SessionFlags {
    Boolean muted;
    Boolean cameraOn;
    Boolean screenSharing;

    public static SessionFlags initial(MediaKind kind) {
        return SessionFlags.builder()
                .muted(false)
                .cameraOn(kind.isVideo())
                .screenSharing(false)
                .build();
    }

    public boolean isEmpty() {
        return muted == null && cameraOn == null && screenSharing == null;
    }
}
