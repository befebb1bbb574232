package com.dispatchplatform.common.exception;

/** Base of the platform's unchecked exceptions. */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
