package com.nevis.hybrid.exception;

public class EmbeddingException extends HybridStoreException {

    public EmbeddingException(String message) {
        super(ErrorKind.EMBEDDING, message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(ErrorKind.EMBEDDING, message, cause);
    }
}
