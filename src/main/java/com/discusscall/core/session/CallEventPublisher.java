package com.discusscall.core.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * 面向 UI 的事件出口。监听器同步执行，监听器抛出的异常不能打断状态机。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CallEventPublisher {

    private final ApplicationEventPublisher delegate;

    public void publish(Object event) {
        try {
            delegate.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("Listener failed on {}", event.getClass().getSimpleName(), e);
        }
    }
}
