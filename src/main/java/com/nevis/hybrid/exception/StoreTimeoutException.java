package com.nevis.hybrid.exception;

import lombok.Getter;

@Getter
public class StoreTimeoutException extends HybridStoreException {

    private final String operation;

    public StoreTimeoutException(String operation, String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, operation + " timed out: " + message, cause);
        this.operation = operation;
    }
}
