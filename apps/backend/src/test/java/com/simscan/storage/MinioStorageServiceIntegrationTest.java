package com.simscan.storage;

import com.simscan.error.NotFoundException;
import io.minio.MinioClient;
import io.minio.RemoveObjectArgs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * 需要本地 MinIO（storage.type=minio），默认构建中通过 tag 排除。
 */
@Tag("integration")
@SpringBootTest(properties = "storage.type=minio")
@ActiveProfiles("test")
class MinioStorageServiceIntegrationTest {

    private static final Logger log = LoggerFactory.getLogger(MinioStorageServiceIntegrationTest.class);

    private final StorageService storageService;
    private final MinioClient client;

    @Value("${storage.minio.default-bucket}")
    private String defaultBucket;

    private String uploadedKey;

    @Autowired
    MinioStorageServiceIntegrationTest(StorageService storageService, MinioClient client) {
        this.storageService = storageService;
        this.client = client;
    }

    @BeforeEach
    void ensureMinioReady() {
        try {
            // 任意调用确保能够连通 MinIO
            client.listBuckets();
            storageService.ensureBucket(defaultBucket).block(Duration.ofSeconds(10));
        } catch (Exception ex) {
            assumeTrue(false, "无法连接 MinIO: " + ex.getMessage());
        }
    }

    @AfterEach
    void cleanup() {
        if (uploadedKey == null) return;
        try {
            client.removeObject(RemoveObjectArgs.builder().bucket(defaultBucket).object(uploadedKey).build());
        } catch (Exception ex) {
            log.warn("清理对象 {} 时出现异常", uploadedKey, ex);
        }
    }

    @Test
    void uploadThenReadHitsRealMinio() {
        uploadedKey = "integration_" + UUID.randomUUID() + ".txt";
        byte[] body = ("真实 MinIO 上传测试 @" + Instant.now()).getBytes(StandardCharsets.UTF_8);
        log.info("上传到 MinIO：bucket='{}', key='{}'", defaultBucket, uploadedKey);

        StepVerifier.create(storageService.uploadBytes(defaultBucket, uploadedKey, body, "text/plain; charset=utf-8"))
                .expectNext(uploadedKey)
                .verifyComplete();

        StepVerifier.create(storageService.getObjectBytes(defaultBucket, uploadedKey))
                .assertNext(bytes -> assertEquals(new String(body, StandardCharsets.UTF_8),
                        new String(bytes, StandardCharsets.UTF_8)))
                .verifyComplete();
    }

    @Test
    void missingObjectIsNotFound() {
        StepVerifier.create(storageService.getObjectBytes(defaultBucket, "missing-" + UUID.randomUUID()))
                .expectError(NotFoundException.class)
                .verify();
    }
}
