package com.simscan.storage;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "storage.minio")
public class MinioProps {
    private String endpoint;
    private String accessKey;
    private String secretKey;
    private String region = "us-east-1";
    private String defaultBucket = "simscan-documents";
}
