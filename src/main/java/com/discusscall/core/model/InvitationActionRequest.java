package com.discusscall.core.model;

import lombok.Data;

/** 接听 / 拒接时只需要 callId */
@Data
public class InvitationActionRequest {
    private String callId;
}
