package com.library.circulation.exception;

public class LoanLimitExceededException extends BusinessException {

    public LoanLimitExceededException(String message) {
        super(ErrorKind.EXCEEDS_LOAN_LIMIT, message);
    }
}
