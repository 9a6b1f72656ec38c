package com.simscan.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

@Configuration
@Slf4j
public class ScanConfig {

    /** Worker pool for the corpus comparison phase of a scan. */
    @Bean(destroyMethod = "dispose")
    public Scheduler compareScheduler(ScanProperties props) {
        log.info("Compare scheduler threads={} queue={} parallelism={}",
                props.getCompareThreads(), props.getCompareQueue(), props.getCompareParallelism());
        return Schedulers.newBoundedElastic(props.getCompareThreads(), props.getCompareQueue(), "scan-compare");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(10);
    }
}
