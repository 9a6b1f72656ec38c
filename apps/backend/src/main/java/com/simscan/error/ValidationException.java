package com.simscan.error;

/** Bad input; never retried. */
public class ValidationException extends SimScanException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String reason() {
        return "validation_error";
    }
}
