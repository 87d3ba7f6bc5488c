package com.discusscall.core.backend;

public class OdooRpcException extends RuntimeException {

    public OdooRpcException(String message) {
        super(message);
    }

    public OdooRpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
