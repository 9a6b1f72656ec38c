package com.simscan;

import lombok.extern.slf4j.Slf4j;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@MapperScan(basePackages = "com.simscan.mapper")
@Slf4j
public class SimScanApplication {

    public static void main(String[] args) {
        log.info("Starting SimScan application");
        SpringApplication.run(SimScanApplication.class, args);
        log.info("SimScan application started");
    }

}
