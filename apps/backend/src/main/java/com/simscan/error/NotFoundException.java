package com.simscan.error;

public class NotFoundException extends SimScanException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String reason() {
        return "not_found";
    }
}
