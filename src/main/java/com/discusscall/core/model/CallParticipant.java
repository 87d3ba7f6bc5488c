package com.discusscall.core.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CallParticipant {
    private long id;         // partner id
    private String name;     // 展示名称
    private String avatar;   // 可选
}
