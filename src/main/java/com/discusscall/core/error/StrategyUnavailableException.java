package com.discusscall.core.error;

/** 所选策略的前置条件（原生 peer connection / 媒体平台）在调用时不满足 */
public class StrategyUnavailableException extends CallException {

    public StrategyUnavailableException(String message) {
        super(CallErrorType.STRATEGY_UNAVAILABLE, message);
    }

    public StrategyUnavailableException(String message, Throwable cause) {
        super(CallErrorType.STRATEGY_UNAVAILABLE, message, cause);
    }
}
