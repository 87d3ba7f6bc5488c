package com.discusscall.core.error;

public class RegistryFailureException extends CallException {

    public RegistryFailureException(String message, Throwable cause) {
        super(CallErrorType.REGISTRY_FAILURE, message, cause);
    }
}
