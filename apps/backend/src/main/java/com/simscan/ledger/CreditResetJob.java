package com.simscan.ledger;

import com.simscan.config.CreditProperties;
import com.simscan.user.domain.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Restores every non-admin balance to the default once a day.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CreditResetJob {

    private final CreditLedger ledger;
    private final CreditProperties props;

    @Scheduled(cron = "${credits.reset-cron:0 0 0 * * *}", zone = "${credits.reset-zone:UTC}")
    public void resetCreditsDaily() {
        log.info("[RESET] running daily credit reset value={}", props.getDefaultBalance());
        try {
            int rows = ledger.resetAll(props.getDefaultBalance(), UserRole.USER.code());
            log.info("[RESET] credits reset for all users, rows affected={}", rows);
        } catch (Exception e) {
            log.error("[RESET] error resetting credits", e);
        }
    }
}
