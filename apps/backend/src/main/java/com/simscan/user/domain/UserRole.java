package com.simscan.user.domain;

public enum UserRole {
    USER("user"),
    ADMIN("admin");

    private final String code;

    UserRole(String code) {
        this.code = code;
    }

    /** Value stored in {@code users.role}. */
    public String code() {
        return code;
    }
}
