package com.flagship.bookkeeping.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bookkeeping.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * REST controller for journal entries.
 *
 * POST accepts a single entry, a JSON array of entries, or {@code {"entries": [...]}},
 * and always answers with the per-item batch result.
 */
@RestController
@RequestMapping("/api/journal")
@RequiredArgsConstructor
@Slf4j
public class JournalController {

    private final JournalService journalService;
    private final JournalBatchService batchService;
    private final ObjectMapper objectMapper;

    @GetMapping
    public JournalPage listEntries(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(name = "account_id", required = false) Long accountId,
            @RequestParam(name = "counterparty", required = false) String counterparty,
            @RequestParam(name = "memo", required = false) String memo,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "per_page", required = false) Integer perPage) {
        JournalQuery query = JournalQuery.builder()
            .startDate(startDate)
            .endDate(endDate)
            .accountId(accountId)
            .counterparty(counterparty)
            .memo(memo)
            .page(page)
            .perPage(perPage)
            .build();
        return journalService.listEntries(query);
    }

    @GetMapping("/recent")
    public List<JournalEntry> recentEntries(@RequestParam(name = "limit", required = false) Integer limit) {
        return journalService.recentEntries(limit);
    }

    @GetMapping("/export")
    public List<JournalEntry> exportEntries(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return journalService.exportEntries(startDate, endDate);
    }

    @GetMapping("/{id}")
    public JournalEntry getEntry(@PathVariable("id") long id) {
        return journalService.getEntry(id);
    }

    @PostMapping
    public BatchResult createEntries(@RequestBody JsonNode body) {
        List<JsonNode> items = toItems(body);
        log.info("Received journal create request: {} entries", items.size());
        return batchService.createEntriesFromJson(items);
    }

    @PutMapping("/{id}")
    public JournalEntry updateEntry(@PathVariable("id") long id, @RequestBody JournalEntryRequest request) {
        return journalService.updateEntry(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteEntry(@PathVariable("id") long id) {
        journalService.deleteEntry(id);
        return ResponseEntity.noContent().build();
    }

    private List<JsonNode> toItems(JsonNode body) {
        JsonNode items;
        if (body == null || body.isNull() || body.isMissingNode()) {
            throw new ValidationException("No journal entries provided");
        } else if (body.isArray()) {
            items = body;
        } else if (body.isObject() && body.has("entries")) {
            items = body.get("entries");
        } else {
            items = objectMapper.createArrayNode().add(body);
        }
        if (!items.isArray() || items.isEmpty()) {
            throw new ValidationException("No journal entries provided");
        }

        List<JsonNode> result = new ArrayList<>(items.size());
        items.forEach(result::add);
        return result;
    }
}
