package com.discusscall.core.signaling;

/** onEnvelope 的订阅句柄，close 后不再收到信封 */
public interface SignalingSubscription extends AutoCloseable {

    @Override
    void close();
}
