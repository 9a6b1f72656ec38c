package com.simscan.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * {@code credits.reset-cron} / {@code credits.reset-zone} are read directly by the
 * {@code @Scheduled} placeholders on {@link com.simscan.ledger.CreditResetJob}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "credits")
public class CreditProperties {

    /** Balance given at registration and restored by the daily reset. */
    private int defaultBalance = 20;

    private int adminBalance = 9999;

    /** 乐观重试次数（锁超时/死锁之类的瞬时错误） */
    private int deductRetries = 3;
}
