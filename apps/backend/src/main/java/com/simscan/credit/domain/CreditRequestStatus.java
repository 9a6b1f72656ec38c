package com.simscan.credit.domain;

public enum CreditRequestStatus {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected");

    private final String code;

    CreditRequestStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
