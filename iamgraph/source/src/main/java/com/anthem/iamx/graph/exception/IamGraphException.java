package com.anthem.iamx.graph.exception;

/**
 * Base class for every failure raised by the permission graph.
 * The error code is stable and safe to print or return to callers.
 */
public class IamGraphException extends RuntimeException {

    private final String errorCode;

    public IamGraphException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public IamGraphException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
