package com.simscan.scan;

/** Lifecycle of one scan request. REJECTED and FAILED are terminal short-circuits. */
public enum ScanState {
    RECEIVED,
    CREDIT_CHECKED,
    PERSISTED,
    COMPARED,
    COMPLETED,
    REJECTED,
    FAILED
}
