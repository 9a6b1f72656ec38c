package com.simscan.api.dto;

import com.simscan.document.domain.CorpusDocument;

import java.time.LocalDateTime;

public record DocumentView(long id, String storageKey, String fileName, long sizeBytes, LocalDateTime uploadedAt) {

    public static DocumentView from(CorpusDocument d) {
        return new DocumentView(d.getId(), d.getStorageKey(), d.getFileName(), d.getSizeBytes(), d.getCreatedAt());
    }
}
