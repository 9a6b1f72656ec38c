package com.simscan.storage.impl;

import com.simscan.error.NotFoundException;
import com.simscan.error.StorageException;
import com.simscan.storage.LocalStorageProps;
import com.simscan.storage.StorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Blob area on the local filesystem: {@code <baseDir>/<bucket>/<objectKey>}.
 * Writes land in a temp file first and are moved into place atomically, so readers never see a partial body.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "storage.type", havingValue = "local", matchIfMissing = true)
public class LocalFileStorageService implements StorageService {

    private final LocalStorageProps props;

    public LocalFileStorageService(LocalStorageProps props) {
        this.props = props;
    }

    @Override
    public String getDefaultBucket() {
        return props.getDefaultBucket();
    }

    @Override
    public Mono<Void> ensureBucket(String bucket) {
        return Mono.fromRunnable(() -> {
            try {
                Files.createDirectories(bucketDir(bucket));
            } catch (IOException e) {
                throw new StorageException("Error creating bucket directory " + bucket, e);
            }
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Mono<String> uploadBytes(String bucket, String objectKey, byte[] data, String contentType) {
        return Mono.fromCallable(() -> {
            Path target = resolve(bucket, objectKey);
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            try {
                Files.createDirectories(target.getParent());
                Files.write(tmp, data);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                deleteQuietly(tmp);
                throw new StorageException("Error writing " + bucket + "/" + objectKey, e);
            }
            log.debug("[STORAGE] wrote bucket={} key={} bytes={}", bucket, objectKey, data.length);
            return objectKey;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<byte[]> getObjectBytes(String bucket, String objectKey) {
        return Mono.fromCallable(() -> {
            Path file = resolve(bucket, objectKey);
            try {
                return Files.readAllBytes(file);
            } catch (NoSuchFileException e) {
                throw new NotFoundException("Object not found: " + bucket + "/" + objectKey);
            } catch (IOException e) {
                throw new StorageException("Error reading " + bucket + "/" + objectKey, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private Path bucketDir(String bucket) {
        return Paths.get(props.getBaseDir()).toAbsolutePath().normalize().resolve(bucket);
    }

    private Path resolve(String bucket, String objectKey) {
        Path dir = bucketDir(bucket);
        Path file = dir.resolve(objectKey).normalize();
        if (!file.startsWith(dir)) {
            throw new StorageException("Object key escapes bucket: " + objectKey);
        }
        return file;
    }

    private void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("[STORAGE] could not remove temp file {}", tmp, e);
        }
    }
}
