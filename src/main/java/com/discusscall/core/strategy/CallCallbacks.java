package com.discusscall.core.strategy;

import com.discusscall.core.error.CallException;
import com.discusscall.core.model.CallSession;
import com.discusscall.core.rtc.RemoteMediaHandle;

/**
 * 策略把异步结果报回状态机的入口。session 用来判断回调是否已经过期（通话已被替换）。
 */
public interface CallCallbacks {

    void onRemoteConnected(CallSession session);

    void onRemoteMedia(CallSession session, RemoteMediaHandle media);

    /** 无法恢复的信令/传输错误，状态机会结束通话 */
    void onSignalingError(CallSession session, CallException error);
}
