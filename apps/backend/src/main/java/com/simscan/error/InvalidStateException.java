package com.simscan.error;

/** An entity is not in a state that allows the requested transition. */
public class InvalidStateException extends SimScanException {

    public InvalidStateException(String message) {
        super(message);
    }

    @Override
    public String reason() {
        return "invalid_state";
    }
}
