package com.simscan.storage;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "storage.local")
public class LocalStorageProps {
    /** 根目录，每个桶一个子目录 */
    private String baseDir = "./uploads";
    private String defaultBucket = "documents";
}
