package com.discusscall.core.error;

public class SignalingFailureException extends CallException {

    public SignalingFailureException(String message, Throwable cause) {
        super(CallErrorType.SIGNALING_FAILURE, message, cause);
    }
}
