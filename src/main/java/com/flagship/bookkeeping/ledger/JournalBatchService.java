package com.flagship.bookkeeping.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bookkeeping.common.exception.BookkeepingException;
import com.flagship.bookkeeping.common.exception.ValidationException;
import com.flagship.bookkeeping.observability.BookkeepingMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Batch creation of journal entries, committed item by item.
 *
 * Not transactional: each item goes through the transactional
 * {@link JournalService#createEntry} on its own, so a rejected item rolls back
 * only itself. Failures become {@link EntryResult#failure} markers in the result,
 * including items whose JSON does not bind to a {@link JournalEntryRequest}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalBatchService {

    private final JournalService journalService;
    private final BookkeepingMetrics metrics;
    private final ObjectMapper objectMapper;

    public BatchResult createEntries(List<JournalEntryRequest> requests) {
        List<EntryResult> results = new ArrayList<>(requests.size());
        for (int index = 0; index < requests.size(); index++) {
            JournalEntryRequest request = requests.get(index);
            String source = request != null ? request.getSource() : null;
            results.add(createOne(index, source, () -> request));
        }
        return finish(results);
    }

    /**
     * Same as {@link #createEntries(List)} for raw JSON items: binding happens per item,
     * so a malformed field fails only its own item.
     */
    public BatchResult createEntriesFromJson(List<JsonNode> items) {
        List<EntryResult> results = new ArrayList<>(items.size());
        for (int index = 0; index < items.size(); index++) {
            JsonNode item = items.get(index);
            String source = item != null && item.hasNonNull("source") ? item.get("source").asText() : null;
            results.add(createOne(index, source, () -> bind(item)));
        }
        return finish(results);
    }

    private EntryResult createOne(int index, String source, Supplier<JournalEntryRequest> request) {
        try {
            JournalEntry created = journalService.createEntry(request.get());
            return EntryResult.success(index, created.getId());
        } catch (BookkeepingException | DataAccessException e) {
            metrics.recordEntryFailed(source != null ? source : JournalService.DEFAULT_SOURCE);
            log.warn("Batch item {} rejected: {}", index, e.getMessage());
            return EntryResult.failure(index, e.getMessage());
        }
    }

    private JournalEntryRequest bind(JsonNode item) {
        if (item == null || !item.isObject()) {
            throw new ValidationException("Journal entry must be a JSON object");
        }
        try {
            return objectMapper.convertValue(item, JournalEntryRequest.class);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Malformed journal entry: " + e.getMessage(), e);
        }
    }

    private BatchResult finish(List<EntryResult> results) {
        BatchResult result = new BatchResult(results);
        log.info("Batch create finished: {} of {} entries created", result.getCreated(), results.size());
        return result;
    }
}
