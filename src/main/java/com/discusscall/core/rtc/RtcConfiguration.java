package com.discusscall.core.rtc;

import com.discusscall.core.config.CallProperties;
import lombok.Value;

import java.util.List;

/** 建 peer connection 用的 ICE 配置 */
@Value
public class RtcConfiguration {
    List<String> iceServers;
    int iceCandidatePoolSize;

    public static RtcConfiguration from(CallProperties properties) {
        return new RtcConfiguration(List.copyOf(properties.getStunServers()),
                properties.getIceCandidatePoolSize());
    }
}
