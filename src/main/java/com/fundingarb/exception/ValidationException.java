package com.fundingarb.exception;

public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, String symbol) {
        super(ErrorCode.VALIDATION_ERROR, message, symbol, null);
    }
}
