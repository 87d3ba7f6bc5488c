package com.discusscall.core.error;

/** 用户未授予麦克风 / 摄像头权限 */
public class PermissionDeniedException extends CallException {

    public PermissionDeniedException(String message, boolean permanent) {
        super(CallErrorType.PERMISSION_DENIED, message, !permanent, null);
    }

    public boolean isPermanent() {
        return !isRetryable();
    }
}
