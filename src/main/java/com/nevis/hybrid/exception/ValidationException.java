package com.nevis.hybrid.exception;

public class ValidationException extends HybridStoreException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
