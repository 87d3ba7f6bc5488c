package com.discusscall.core.model;

import lombok.Value;

/** 当前登录用户：uid + partner id */
@Value
public class LocalIdentity {
    long userId;
    long partnerId;
    String name;
}
