package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.ledger.dto.OpeningBalanceRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/opening-balances")
@RequiredArgsConstructor
public class OpeningBalanceController {

    private final OpeningBalanceService openingBalanceService;

    @GetMapping("/{fiscalYear}")
    public List<OpeningBalance> listOpeningBalances(@PathVariable("fiscalYear") int fiscalYear) {
        return openingBalanceService.listOpeningBalances(fiscalYear);
    }

    @PutMapping("/{fiscalYear}")
    public List<OpeningBalance> saveOpeningBalances(@PathVariable("fiscalYear") int fiscalYear,
                                                    @RequestBody List<OpeningBalanceRequest> rows) {
        return openingBalanceService.saveOpeningBalances(fiscalYear, rows);
    }
}
