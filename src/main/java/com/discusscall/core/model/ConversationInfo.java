package com.discusscall.core.model;

import lombok.Value;

@Value
public class ConversationInfo {
    long id;
    String name;

    /** 一对一私聊（Odoo 里 channel_type = chat） */
    boolean direct;
}
