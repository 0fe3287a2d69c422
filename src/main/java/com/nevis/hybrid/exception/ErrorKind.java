package com.nevis.hybrid.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorKind {
    DIMENSION_MISMATCH(false),
    EMBEDDING(true),
    NOT_FOUND(false),
    TIMEOUT(true),
    FILTER(false),
    VALIDATION(false),
    CONFLICT(false),
    STORAGE(true);

    private final boolean retryable;
}
