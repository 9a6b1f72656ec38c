package com.simscan.error;

/** No (or an unknown) caller identity. */
public class UnauthorizedException extends SimScanException {

    public UnauthorizedException(String message) {
        super(message);
    }

    @Override
    public String reason() {
        return "unauthorized";
    }
}
