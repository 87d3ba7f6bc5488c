package com.discusscall.core.strategy;

import com.discusscall.core.model.CallInvitation;
import com.discusscall.core.model.CallSession;
import com.discusscall.core.model.CallStrategyType;

/**
 * 三种通话档位的统一接口，状态机不关心具体是哪一种。
 *
 * start / answer 可以修改 session 上的 registryId、媒体句柄等字段；
 * 失败时抛 CallException，已经申请的资源由 StrategyChain 统一释放。
 */
public interface CallStrategy {

    CallStrategyType type();

    boolean isAvailable();

    /** @return callId */
    String start(CallSession session, CallCallbacks callbacks);

    void answer(CallSession session, CallInvitation invitation, CallCallbacks callbacks);

    /** @return 切换后是否静音 */
    boolean toggleAudio(CallSession session);

    /** @return 切换后摄像头是否打开 */
    boolean toggleVideo(CallSession session);

    /** 策略自己的收尾（通知消息、信令订阅），媒体和 registry 由状态机处理 */
    void end(CallSession session);

    /** 接听后是否立即视为已连接（对端早就在线了） */
    default boolean connectsOnAnswer() {
        return true;
    }
}
