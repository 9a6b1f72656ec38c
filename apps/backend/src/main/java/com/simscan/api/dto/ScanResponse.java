package com.simscan.api.dto;

import com.simscan.scan.Match;
import com.simscan.scan.ScanResult;

import java.util.List;

public record ScanResponse(
        String message,
        long documentId,
        String storageKey,
        String fileName,
        int creditsLeft,
        List<Match> matches,
        int comparedDocuments,
        int skippedDocuments
) {
    public static ScanResponse from(ScanResult r) {
        return new ScanResponse(
                "Document uploaded successfully!",
                r.documentId(),
                r.storageKey(),
                r.fileName(),
                r.creditsLeft(),
                r.matches(),
                r.comparedDocuments(),
                r.skippedDocuments()
        );
    }
}
