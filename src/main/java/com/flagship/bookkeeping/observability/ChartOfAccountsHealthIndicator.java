package com.flagship.bookkeeping.observability;

import com.flagship.bookkeeping.asset.FixedAssetService;
import com.flagship.bookkeeping.ledger.AccountService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Reports DOWN when the chart of accounts has no active account:
 * no journal entry can be posted until one is created.
 */
@Component("chartOfAccounts")
public class ChartOfAccountsHealthIndicator implements HealthIndicator {

    private final AccountService accountService;
    private final FixedAssetService fixedAssetService;

    public ChartOfAccountsHealthIndicator(AccountService accountService, FixedAssetService fixedAssetService) {
        this.accountService = accountService;
        this.fixedAssetService = fixedAssetService;
    }

    @Override
    public Health health() {
        try {
            long activeAccounts = accountService.countActiveAccounts();
            Health.Builder builder = activeAccounts > 0 ? Health.up() : Health.down();
            return builder
                    .withDetail("activeAccounts", activeAccounts)
                    .withDetail("fixedAssets", fixedAssetService.countAssets())
                    .build();
        } catch (DataAccessException e) {
            return Health.down(e).build();
        }
    }
}
