package com.simscan.scan;

import lombok.Builder;

import java.util.List;

@Builder
public record ScanResult(
        ScanState state,
        long documentId,
        String storageKey,
        String fileName,
        int creditsLeft,
        List<Match> matches,
        int comparedDocuments,
        int skippedDocuments
) {}
