package com.discusscall.core.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OutgoingMessage {

    public static final String TYPE_COMMENT = "comment";
    public static final String TYPE_NOTIFICATION = "notification";

    String body;
    String subject;
    String messageType;

    public static OutgoingMessage comment(String body) {
        return OutgoingMessage.builder().body(body).messageType(TYPE_COMMENT).build();
    }

    public static OutgoingMessage notification(String body) {
        return OutgoingMessage.builder().body(body).messageType(TYPE_NOTIFICATION).build();
    }
}
