package com.flagship.payroll_ledger.observability;

import com.flagship.payroll_ledger.ledger.LedgerStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports DOWN if any posted journal does not balance.
 *
 * The database triggers make this impossible through the application, so a non-zero
 * count means someone wrote to the ledger tables directly.
 */
@Component("ledgerHealth")
public class LedgerHealthIndicator implements HealthIndicator {

    private final LedgerStore ledgerStore;

    public LedgerHealthIndicator(LedgerStore ledgerStore) {
        this.ledgerStore = ledgerStore;
    }

    @Override
    public Health health() {
        try {
            long unbalanced = ledgerStore.countUnbalancedPostedJournals();

            Health.Builder builder = unbalanced == 0 ? Health.up() : Health.down();
            return builder
                    .withDetail("unbalancedPostedJournals", unbalanced)
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
