package com.simscan.api.dto;

/** Body of {@code POST /scan}; missing fields are rejected by the orchestrator. */
public record ScanRequest(String text, String fileName) {}
