package com.simscan.corpus;

/** Metadata of one stored document as seen by a corpus scan. */
public record CorpusEntry(
        long documentId,
        String storageKey,
        String displayName,
        long ownerId
) {}
