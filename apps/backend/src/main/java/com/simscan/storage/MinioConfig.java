package com.simscan.storage;

import io.minio.MinioClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "storage.type", havingValue = "minio")
public class MinioConfig {

    @Bean
    public MinioClient minioClient(MinioProps props) {
        return MinioClient.builder()
                .endpoint(props.getEndpoint())
                .region(props.getRegion())
                .credentials(props.getAccessKey(), props.getSecretKey())
                .build();
    }
}
