package com.simscan.error;

import lombok.Getter;

/** Business rule rejection: the caller cannot pay for the requested scan. */
@Getter
public class InsufficientCreditException extends SimScanException {

    private final long userId;
    private final int required;

    public InsufficientCreditException(long userId, int required) {
        super("Insufficient credits! Please request more.");
        this.userId = userId;
        this.required = required;
    }

    @Override
    public String reason() {
        return "insufficient_credit";
    }
}
