package com.simscan.corpus.impl;

import com.simscan.corpus.CorpusEntry;
import com.simscan.corpus.CorpusStore;
import com.simscan.document.domain.CorpusDocument;
import com.simscan.error.SimScanException;
import com.simscan.error.StorageException;
import com.simscan.mapper.DocumentMapper;
import com.simscan.storage.StorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.concurrent.TimeoutException;

/**
 * Corpus over the blob area (bodies) and the {@code documents} table (metadata).
 */
@Slf4j
@Component
public class BlobCorpusStore implements CorpusStore {

    static final String CONTENT_TYPE = "text/plain; charset=utf-8";
    private static final int MAX_NAME_LENGTH = 120;

    private final StorageService storage;
    private final DocumentMapper documentMapper;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public BlobCorpusStore(StorageService storage, DocumentMapper documentMapper, Clock clock) {
        this.storage = storage;
        this.documentMapper = documentMapper;
        this.clock = clock;
    }

    /** {@code <epochMillis>_<8 hex>_<safe name>} */
    @Override
    public String allocateKey(String fileName) {
        byte[] suffix = new byte[4];
        random.nextBytes(suffix);
        return clock.millis() + "_" + HexFormat.of().formatHex(suffix) + "_" + safeFileName(fileName);
    }

    @Override
    public Mono<Void> put(String storageKey, String text, Duration timeout) {
        String bucket = storage.getDefaultBucket();
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        return storage.ensureBucket(bucket)
                .then(storage.uploadBytes(bucket, storageKey, bytes, CONTENT_TYPE))
                .timeout(timeout)
                .onErrorMap(e -> toStorageError("write", storageKey, timeout, e))
                .then();
    }

    @Override
    public Flux<CorpusEntry> listExcept(String storageKey) {
        return Flux.defer(() -> Flux.fromIterable(documentMapper.selectAllExcept(storageKey)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(BlobCorpusStore::toEntry)
                .onErrorMap(e -> !(e instanceof SimScanException),
                        e -> new StorageException("Failed to list corpus", e));
    }

    @Override
    public Mono<String> read(String storageKey, Duration timeout) {
        return storage.getObjectBytes(storage.getDefaultBucket(), storageKey)
                .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                .timeout(timeout)
                .onErrorMap(e -> toStorageError("read", storageKey, timeout, e));
    }

    private static Throwable toStorageError(String op, String storageKey, Duration timeout, Throwable e) {
        if (e instanceof SimScanException) {
            return e;
        }
        if (e instanceof TimeoutException) {
            return new StorageException("Timed out after " + timeout.toMillis() + "ms on " + op + " of " + storageKey, e);
        }
        return new StorageException("Failed to " + op + " " + storageKey, e);
    }

    private static CorpusEntry toEntry(CorpusDocument doc) {
        return new CorpusEntry(doc.getId(), doc.getStorageKey(), doc.getFileName(), doc.getUserId());
    }

    static String safeFileName(String s) {
        if (s == null || s.isBlank()) return "unnamed";
        // 去掉路径分隔、只保留常见字符
        String base = s.replaceAll("[/\\\\]+", "_").replaceAll("[^a-zA-Z0-9._-]", "_");
        return base.length() > MAX_NAME_LENGTH ? base.substring(0, MAX_NAME_LENGTH) : base;
    }
}
