package com.simscan.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Admin account created at startup when none exists yet. */
@Data
@Configuration
@ConfigurationProperties(prefix = "simscan.admin")
public class AdminProperties {
    private String username = "admin";
    private String email = "admin@example.com";
    /** Leave empty to skip the bootstrap. */
    private String password;
}
