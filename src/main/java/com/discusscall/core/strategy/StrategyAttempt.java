package com.discusscall.core.strategy;

import com.discusscall.core.error.CallException;
import com.discusscall.core.model.CallStrategyType;
import lombok.Value;

/** 按档位尝试的结果：成功给出 callId 和实际使用的档位，失败给出最后一个错误 */
@Value
public class StrategyAttempt {
    boolean success;
    CallStrategyType strategy;
    String callId;
    CallException error;

    public static StrategyAttempt success(CallStrategyType strategy, String callId) {
        return new StrategyAttempt(true, strategy, callId, null);
    }

    public static StrategyAttempt failure(CallStrategyType lastTried, CallException error) {
        return new StrategyAttempt(false, lastTried, null, error);
    }
}
