package com.library.circulation.exception;

public class ValidationException extends BusinessException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }
}
