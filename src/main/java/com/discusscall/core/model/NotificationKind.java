package com.discusscall.core.model;

public enum NotificationKind {
    CALL_INVITATION("call-invitation"),
    RECORD_CREATED("record-created"),
    RECORD_UPDATED("record-updated"),
    RECORD_REMOVED("record-removed"),
    RECORD_JOINED("record-joined"),
    OTHER("other");

    private final String tag;

    NotificationKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static NotificationKind fromTag(String tag) {
        for (NotificationKind k : values()) {
            if (k.tag.equals(tag)) {
                return k;
            }
        }
        return OTHER;
    }
}
