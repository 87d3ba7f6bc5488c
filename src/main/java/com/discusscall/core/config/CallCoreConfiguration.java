package com.discusscall.core.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(CallProperties.class)
public class CallCoreConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 响铃超时、registry 轮询、事件通道轮询共用的调度器。
     */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler callTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("call-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public RestTemplate odooRestTemplate(RestTemplateBuilder builder, CallProperties properties) {
        return builder
                .setConnectTimeout(properties.getBackend().getConnectTimeout())
                .setReadTimeout(properties.getBackend().getReadTimeout())
                .build();
    }
}
