package com.simscan.corpus;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Durable store of document bodies plus the read-back view used by scans.
 */
public interface CorpusStore {

    /**
     * Generates a fresh storage key for a submission. Keys are unique even when the
     * supplied file names repeat within the same clock tick.
     */
    String allocateKey(String fileName);

    /**
     * Persists the body under the key. Emits {@link com.simscan.error.StorageException}
     * on I/O failure or when {@code timeout} expires.
     */
    Mono<Void> put(String storageKey, String text, Duration timeout);

    /** Every stored document except the given key. Order carries no meaning. */
    Flux<CorpusEntry> listExcept(String storageKey);

    /**
     * Emits {@link com.simscan.error.NotFoundException} when the body is missing,
     * {@link com.simscan.error.StorageException} on I/O failure or timeout.
     */
    Mono<String> read(String storageKey, Duration timeout);
}
