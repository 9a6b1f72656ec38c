package com.simscan.user;

import com.simscan.config.AdminProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Creates the single admin account on first start. */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdminBootstrap implements ApplicationRunner {

    private final AccountService accountService;
    private final AdminProperties props;

    @Override
    public void run(ApplicationArguments args) {
        if (accountService.adminExists()) {
            log.info("[ADMIN] admin user already exists");
            return;
        }
        if (!StringUtils.hasText(props.getPassword())) {
            log.error("[ADMIN] simscan.admin.password is not set; skipping admin creation");
            return;
        }
        var admin = accountService.createAdmin(props.getUsername(), props.getEmail(), props.getPassword());
        log.info("[ADMIN] admin created id={} username={}", admin.getId(), admin.getUsername());
    }
}
