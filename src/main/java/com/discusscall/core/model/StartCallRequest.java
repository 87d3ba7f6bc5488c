package com.discusscall.core.model;

import lombok.Data;

@Data
public class StartCallRequest {
    private long conversationId;
    private String conversationName;
    private boolean video;
}
