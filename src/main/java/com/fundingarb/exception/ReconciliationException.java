package com.fundingarb.exception;

public class ReconciliationException extends BaseException {

    public ReconciliationException(String message, Throwable cause) {
        super(ErrorCode.RECONCILIATION_ERROR, message, cause);
    }
}
