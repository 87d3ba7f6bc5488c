package com.discusscall.core.model;

import com.discusscall.core.error.CallErrorType;
import lombok.Value;

/**
 * startCall / answerCall 的结果。发起阶段的错误都折叠到这里，不往 UI 抛异常。
 */
@Value
public class CallResult {

    public static final String START_FAILED_MESSAGE = "Unable to start call - check your connection";

    boolean success;
    CallSession call;
    CallErrorType errorType;
    String message;

    public static CallResult ok(CallSession call) {
        return new CallResult(true, call, null, null);
    }

    public static CallResult failed(CallErrorType errorType) {
        return new CallResult(false, null, errorType, START_FAILED_MESSAGE);
    }
}
