package com.simscan.document.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Metadata of one stored submission. The body itself lives in the blob area under {@link #storageKey}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorpusDocument {

    private Long id;

    private Long userId;

    private String storageKey;

    /** File name as supplied by the submitter. */
    private String fileName;

    private Long sizeBytes;

    private String sha256;

    private LocalDateTime createdAt;
}
