package com.simscan.storage.impl;

import com.simscan.error.NotFoundException;
import com.simscan.error.StorageException;
import com.simscan.storage.MinioProps;
import com.simscan.storage.StorageService;
import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.errors.MinioException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.Set;

/**
 * S3-compatible blob area backed by MinIO. All SDK calls are blocking and run on boundedElastic.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "storage.type", havingValue = "minio")
public class MinioStorageService implements StorageService {

    private static final Set<String> MISSING_CODES = Set.of("NoSuchKey", "NoSuchBucket", "NoSuchObject");

    private final MinioClient client;
    private final MinioProps props;

    public MinioStorageService(MinioClient client, MinioProps props) {
        this.client = client;
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
                boolean exists = client.bucketExists(
                        BucketExistsArgs.builder().bucket(bucket).build()
                );
                if (!exists) {
                    client.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
                    log.info("[STORAGE] created bucket={}", bucket);
                }
            } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
                throw new StorageException("Error handling bucket " + bucket, e);
            }
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Mono<String> uploadBytes(String bucket, String objectKey, byte[] data, String contentType) {
        return Mono.fromCallable(() -> {
            try (ByteArrayInputStream in = new ByteArrayInputStream(data)) {
                // objectSize 已知，用 data.length；partSize 设为 -1 让 SDK 自适应
                client.putObject(
                        PutObjectArgs.builder()
                                .bucket(bucket)
                                .object(objectKey)
                                .stream(in, data.length, -1)
                                .contentType(contentType)
                                .build()
                );
                return objectKey;
            } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
                throw new StorageException("Error uploading " + bucket + "/" + objectKey, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<byte[]> getObjectBytes(String bucket, String objectKey) {
        return Mono.fromCallable(() -> {
            try (GetObjectResponse in = client.getObject(
                    GetObjectArgs.builder().bucket(bucket).object(objectKey).build()
            )) {
                return in.readAllBytes();
            } catch (ErrorResponseException e) {
                if (e.errorResponse() != null && MISSING_CODES.contains(e.errorResponse().code())) {
                    throw new NotFoundException("Object not found: " + bucket + "/" + objectKey);
                }
                throw new StorageException("Error reading " + bucket + "/" + objectKey, e);
            } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
                throw new StorageException("Error reading " + bucket + "/" + objectKey, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
