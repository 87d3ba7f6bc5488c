package com.discusscall.core.config;

import com.discusscall.core.model.CallStrategyType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * discuss.call.* 配置，默认值见 application.yml。
 */
@Data
@ConfigurationProperties(prefix = "discuss.call")
public class CallProperties {

    private Backend backend = new Backend();
    private Media media = new Media();

    /** 公共 STUN 服务器池 */
    private List<String> stunServers = new ArrayList<>(List.of(
            "stun:stun.l.google.com:19302",
            "stun:stun1.l.google.com:19302",
            "stun:stun2.l.google.com:19302",
            "stun:stun3.l.google.com:19302",
            "stun:stun4.l.google.com:19302"
    ));

    private int iceCandidatePoolSize = 10;

    /** 来电无人接听多久后自动挂断 */
    private Duration ringTimeout = Duration.ofSeconds(30);

    /** 通话中轮询 registry 记录的间隔 */
    private Duration registryPollInterval = Duration.ofSeconds(5);

    /** 事件通道轮询间隔 */
    private Duration feedPollInterval = Duration.ofSeconds(1);

    /** 旧记录清理最多等多久，超时后直接继续建新通话 */
    private Duration cleanupTimeout = Duration.ofSeconds(3);

    /** 单个信令信封发送失败后的重试次数 */
    private int signalingRetryAttempts = 1;

    /** 强制使用某个策略（例如验证信令链路时用 SIGNALING_ONLY），为空则自动探测 */
    private CallStrategyType strategyOverride;

    /** 启动时就订阅事件通道的会话 id */
    private List<Long> watchedConversations = new ArrayList<>();

    /** 单次轮询最多拉取的新消息条数 */
    private int feedBatchSize = 50;

    @Data
    public static class Backend {
        private String url = "http://localhost:8069";
        private String database;
        private String login;
        private String password;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);
    }

    @Data
    public static class Media {
        private int sampleRate = 48000;
        private int channelCount = 1;
        private int videoWidth = 640;
        private int videoHeight = 480;
        private int frameRate = 30;
    }
}
