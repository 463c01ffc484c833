package com.flagship.bookkeeping.asset;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/depreciation")
@RequiredArgsConstructor
public class DepreciationController {

    private final DepreciationScheduler depreciationScheduler;

    @GetMapping("/{fiscalYear}")
    public List<DepreciationRow> depreciationSchedule(@PathVariable("fiscalYear") int fiscalYear) {
        return depreciationScheduler.compute(fiscalYear);
    }
}
