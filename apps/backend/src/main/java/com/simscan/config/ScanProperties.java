package com.simscan.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "scan")
public class ScanProperties {

    /** Matches must score strictly above this value. */
    private double threshold = 0.6;

    /** 每次扫描扣除的点数 */
    private int costPerScan = 1;

    /** Concurrent reads/comparisons against the stored corpus within one scan. */
    private int compareParallelism = 4;

    private int compareThreads = 8;
    private int compareQueue = 1000;

    /** Timeout applied to every blob read and write. */
    private Duration storageTimeout = Duration.ofSeconds(10);

    /**
     * Grant the scan cost back when persisting the document fails after the deduction.
     * Off by default: a failed store leaves the user debited.
     */
    private boolean refundOnStorageFailure = false;
}
