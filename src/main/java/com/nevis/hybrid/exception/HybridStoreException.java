package com.nevis.hybrid.exception;

import lombok.Getter;

/**
 * Base of every error the store reports to its callers.
 */
@Getter
public abstract class HybridStoreException extends RuntimeException {

    private final ErrorKind kind;

    protected HybridStoreException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected HybridStoreException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
