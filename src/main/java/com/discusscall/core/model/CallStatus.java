package com.discusscall.core.model;

/**
 * 通话生命周期状态。
 * idle -> connecting -> connected -> ended，failed 是与 ended 并列的终态。
 */
public enum CallStatus {
    IDLE,
    CONNECTING,
    CONNECTED,
    ENDED,
    FAILED;

    public boolean isTerminal() {
        return this == ENDED || this == FAILED;
    }

    public boolean isLive() {
        return this == CONNECTING || this == CONNECTED;
    }
}
