package com.simscan.storage;

import reactor.core.publisher.Mono;

/**
 * Blob area holding raw document bodies, addressed by bucket + object key.
 */
public interface StorageService {

    /** 默认桶名 */
    String getDefaultBucket();

    /** 确保桶存在（幂等） */
    Mono<Void> ensureBucket(String bucket);

    /**
     * Stores the bytes under the given key and emits the key.
     * Fails with {@link com.simscan.error.StorageException} on I/O errors.
     */
    Mono<String> uploadBytes(String bucket, String objectKey, byte[] data, String contentType);

    /**
     * Reads the whole object into memory.
     * Fails with {@link com.simscan.error.NotFoundException} when the key is absent,
     * {@link com.simscan.error.StorageException} on any other I/O error.
     */
    Mono<byte[]> getObjectBytes(String bucket, String objectKey);
}
