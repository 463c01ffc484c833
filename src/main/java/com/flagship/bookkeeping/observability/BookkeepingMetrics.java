package com.flagship.bookkeeping.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Centralized metrics for the bookkeeping engine.
 *
 * Metrics exposed:
 * - bookkeeping.journal.created: journal entries committed, tagged by source (manual, receipt, statement, other)
 * - bookkeeping.journal.failed: batch items rejected, tagged by source
 * - bookkeeping.report.duration: report computation time, tagged by report kind
 */
@Component
public class BookkeepingMetrics {

    public static final String REPORT_TRIAL_BALANCE = "trial_balance";
    public static final String REPORT_GENERAL_LEDGER = "general_ledger";
    public static final String REPORT_DEPRECIATION = "depreciation";

    static final String SOURCE_OTHER = "other";
    static final Set<String> SOURCE_TAGS = Set.of("manual", "receipt", "statement");

    private final MeterRegistry registry;

    public BookkeepingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEntryCreated(String source) {
        registry.counter("bookkeeping.journal.created", "source", sourceTag(source)).increment();
    }

    public void recordEntryFailed(String source) {
        registry.counter("bookkeeping.journal.failed", "source", sourceTag(source)).increment();
    }

    /**
     * Times a report computation.
     */
    public <T> T timeReport(String report, Supplier<T> computation) {
        Timer timer = Timer.builder("bookkeeping.report.duration")
            .description("Time taken to compute a report")
            .tag("report", report)
            .register(registry);
        return timer.record(computation);
    }

    /**
     * Maps a caller-supplied provenance onto {@link #SOURCE_TAGS}; anything else is {@code other}.
     */
    static String sourceTag(String source) {
        if (source == null) {
            return SOURCE_OTHER;
        }
        String normalized = source.trim().toLowerCase(Locale.ROOT);
        return SOURCE_TAGS.contains(normalized) ? normalized : SOURCE_OTHER;
    }
}
