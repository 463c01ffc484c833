package com.flagship.bookkeeping.asset;

import com.flagship.bookkeeping.asset.dto.DisposalRequest;
import com.flagship.bookkeeping.asset.dto.FixedAssetRequest;
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

/**
 * REST controller for the fixed-asset register.
 */
@RestController
@RequestMapping("/api/fixed-assets")
@RequiredArgsConstructor
public class FixedAssetController {

    private final FixedAssetService fixedAssetService;
    private final DepreciationScheduler depreciationScheduler;

    @GetMapping
    public List<FixedAsset> listAssets() {
        return fixedAssetService.listAssets();
    }

    @GetMapping("/{id}")
    public FixedAsset getAsset(@PathVariable("id") long id) {
        return fixedAssetService.getAsset(id);
    }

    @PostMapping
    public ResponseEntity<FixedAsset> createAsset(@Valid @RequestBody FixedAssetRequest request) {
        FixedAsset asset = fixedAssetService.createAsset(
            request.getName(),
            request.getAcquisitionDate(),
            request.getUsefulLife(),
            request.getAcquisitionCost(),
            request.getNotes());
        return ResponseEntity.status(HttpStatus.CREATED).body(asset);
    }

    @PutMapping("/{id}")
    public FixedAsset updateAsset(@PathVariable("id") long id, @Valid @RequestBody FixedAssetRequest request) {
        return fixedAssetService.updateAsset(
            id,
            request.getName(),
            request.getAcquisitionDate(),
            request.getUsefulLife(),
            request.getAcquisitionCost(),
            request.getNotes());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteAsset(@PathVariable("id") long id) {
        fixedAssetService.deleteAsset(id);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{id}/disposal")
    public FixedAsset setDisposal(@PathVariable("id") long id, @Valid @RequestBody DisposalRequest request) {
        return fixedAssetService.setDisposal(
            id, request.getDisposalType(), request.getDisposalDate(), request.getDisposalProceeds());
    }

    @DeleteMapping("/{id}/disposal")
    public FixedAsset cancelDisposal(@PathVariable("id") long id) {
        return fixedAssetService.cancelDisposal(id);
    }

    @GetMapping("/{id}/schedule")
    public List<DepreciationRow> lifetimeSchedule(@PathVariable("id") long id) {
        return depreciationScheduler.lifetimeSchedule(id);
    }
}
