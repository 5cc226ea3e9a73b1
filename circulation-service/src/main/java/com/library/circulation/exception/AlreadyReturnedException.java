package com.library.circulation.exception;

public class AlreadyReturnedException extends BusinessException {

    public AlreadyReturnedException(String message) {
        super(ErrorKind.ALREADY_RETURNED, message);
    }
}
