package com.library.circulation.exception;

public class OutOfStockException extends BusinessException {

    public OutOfStockException(String message) {
        super(ErrorKind.OUT_OF_STOCK, message);
    }
}
