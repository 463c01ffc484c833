package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.ledger.dto.CounterpartyRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the counterparty master.
 */
@RestController
@RequestMapping("/api/counterparties")
@RequiredArgsConstructor
public class CounterpartyController {

    private final CounterpartyService counterpartyService;

    @GetMapping
    public List<Counterparty> listCounterparties() {
        return counterpartyService.listCounterparties();
    }

    /**
     * Name suggestions for journal input.
     */
    @GetMapping("/names")
    public Map<String, List<String>> counterpartyNames() {
        return Map.of("counterparties", counterpartyService.counterpartyNames());
    }

    @GetMapping("/{id}")
    public Counterparty getCounterparty(@PathVariable("id") long id) {
        return counterpartyService.getCounterparty(id);
    }

    @PostMapping
    public ResponseEntity<Counterparty> createCounterparty(@Valid @RequestBody CounterpartyRequest request) {
        Counterparty counterparty = counterpartyService.createCounterparty(
            request.getName(), request.getCode(), request.getContactInfo(), request.getNotes());
        return ResponseEntity.status(HttpStatus.CREATED).body(counterparty);
    }

    @PutMapping("/{id}")
    public Counterparty updateCounterparty(@PathVariable("id") long id, @Valid @RequestBody CounterpartyRequest request) {
        return counterpartyService.updateCounterparty(
            id, request.getName(), request.getCode(), request.getContactInfo(), request.getNotes());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteCounterparty(@PathVariable("id") long id) {
        counterpartyService.deleteCounterparty(id);
        return ResponseEntity.noContent().build();
    }
}
