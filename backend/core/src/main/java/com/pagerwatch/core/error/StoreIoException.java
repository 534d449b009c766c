package com.pagerwatch.core.error;

public class StoreIoException extends RuntimeException {
    public StoreIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
