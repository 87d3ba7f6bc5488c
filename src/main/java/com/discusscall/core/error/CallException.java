package com.discusscall.core.error;

import lombok.Getter;

/**
 * 通话核心的异常基类。
 * retryable=false 表示调用方重试也没用（例如权限被永久拒绝），状态机据此进入 FAILED。
 */
@Getter
public class CallException extends RuntimeException {

    private final CallErrorType type;
    private final boolean retryable;

    public CallException(CallErrorType type, String message) {
        this(type, message, true, null);
    }

    public CallException(CallErrorType type, String message, Throwable cause) {
        this(type, message, true, cause);
    }

    public CallException(CallErrorType type, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.retryable = retryable;
    }

    public static CallException cancelled(String message) {
        return new CallException(CallErrorType.CANCELLED, message);
    }

    public boolean isCancelled() {
        return type == CallErrorType.CANCELLED;
    }
}
