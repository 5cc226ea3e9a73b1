package com.library.circulation.exception;

public class OverdueLoansException extends BusinessException {

    public OverdueLoansException(String message) {
        super(ErrorKind.HAS_OVERDUE_LOANS, message);
    }
}
