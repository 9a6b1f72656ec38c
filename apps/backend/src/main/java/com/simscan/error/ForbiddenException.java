package com.simscan.error;

public class ForbiddenException extends SimScanException {

    public ForbiddenException(String message) {
        super(message);
    }

    @Override
    public String reason() {
        return "forbidden";
    }
}
