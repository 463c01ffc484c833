package com.flagship.bookkeeping.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed settings bound from the {@code bookkeeping.*} namespace.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "bookkeeping")
public class BookkeepingProperties {

    private Journal journal = new Journal();

    @Getter
    @Setter
    public static class Journal {

        /**
         * Account used when a candidate entry names an account that is not in the
         * chart of accounts. Blank disables the fallback.
         */
        private String fallbackAccountName = "Miscellaneous Expense";

        /**
         * Tax classification label applied when a request omits one.
         */
        private String defaultTaxClassification = "10%";

        private int defaultPageSize = 20;

        private int maxPageSize = 100;

        private int recentLimit = 5;

        public boolean hasFallbackAccount() {
            return fallbackAccountName != null && !fallbackAccountName.isBlank();
        }
    }
}
