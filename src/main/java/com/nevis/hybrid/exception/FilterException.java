package com.nevis.hybrid.exception;

public class FilterException extends HybridStoreException {

    public FilterException(String message) {
        super(ErrorKind.FILTER, message);
    }
}
