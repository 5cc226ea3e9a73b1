package com.library.circulation.exception;

import lombok.Getter;

/**
 * Expected, caller-recoverable rejection of an operation.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorKind kind;

    public BusinessException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
