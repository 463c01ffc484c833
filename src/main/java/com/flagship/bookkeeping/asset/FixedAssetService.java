package com.flagship.bookkeeping.asset;

import com.flagship.bookkeeping.common.exception.NotFoundException;
import com.flagship.bookkeeping.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * Fixed-asset register: CRUD plus disposal set/cancel.
 *
 * Bridges the domain object ({@link FixedAsset}) and the persistence entity ({@link FixedAssetEntity}).
 * Deleted assets behave as unknown ids.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FixedAssetService {

    private final FixedAssetRepository repository;

    @Transactional
    public FixedAsset createAsset(String name, LocalDate acquisitionDate, int usefulLife,
                                  long acquisitionCost, String notes) {
        validateAsset(name, acquisitionDate, usefulLife, acquisitionCost);
        FixedAssetEntity saved = repository.save(
            FixedAssetEntity.newAsset(name.trim(), acquisitionDate, usefulLife, acquisitionCost, notes));
        log.info("Registered fixed asset {} '{}' cost={} life={}y", saved.getId(), saved.getName(),
            acquisitionCost, usefulLife);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public FixedAsset getAsset(long assetId) {
        return load(assetId).toDomain();
    }

    /**
     * Non-deleted assets by acquisition date, then id.
     */
    @Transactional(readOnly = true)
    public List<FixedAsset> listAssets() {
        return repository.findByDeletedFalseOrderByAcquisitionDateAscIdAsc().stream()
            .map(FixedAssetEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countAssets() {
        return repository.countByDeletedFalse();
    }

    @Transactional
    public FixedAsset updateAsset(long assetId, String name, LocalDate acquisitionDate, int usefulLife,
                                  long acquisitionCost, String notes) {
        validateAsset(name, acquisitionDate, usefulLife, acquisitionCost);
        FixedAssetEntity entity = load(assetId);
        if (entity.getDisposalDate() != null && entity.getDisposalDate().isBefore(acquisitionDate)) {
            throw new ValidationException(
                "Acquisition date " + acquisitionDate + " is after the recorded disposal date "
                    + entity.getDisposalDate());
        }
        entity.updateFrom(name.trim(), acquisitionDate, usefulLife, acquisitionCost, notes);
        FixedAssetEntity saved = repository.save(entity);
        log.info("Updated fixed asset {}", assetId);
        return saved.toDomain();
    }

    @Transactional
    public void deleteAsset(long assetId) {
        FixedAssetEntity entity = load(assetId);
        entity.markDeleted();
        repository.save(entity);
        log.info("Deleted fixed asset {}", assetId);
    }

    /**
     * Records (or replaces) the disposal of an asset.
     */
    @Transactional
    public FixedAsset setDisposal(long assetId, DisposalType type, LocalDate disposalDate, Long proceeds) {
        if (type == null) {
            throw new ValidationException("Disposal type is required");
        }
        if (disposalDate == null) {
            throw new ValidationException("Disposal date is required");
        }
        FixedAssetEntity entity = load(assetId);
        if (disposalDate.isBefore(entity.getAcquisitionDate())) {
            throw new ValidationException(
                "Disposal date " + disposalDate + " is before acquisition date " + entity.getAcquisitionDate());
        }
        if (type == DisposalType.SALE && (proceeds == null || proceeds < 0)) {
            throw new ValidationException("Sale proceeds are required and must not be negative");
        }
        entity.dispose(type, disposalDate, proceeds);
        FixedAssetEntity saved = repository.save(entity);
        log.info("Recorded {} of fixed asset {} on {}", type, assetId, disposalDate);
        return saved.toDomain();
    }

    @Transactional
    public FixedAsset cancelDisposal(long assetId) {
        FixedAssetEntity entity = load(assetId);
        entity.cancelDisposal();
        FixedAssetEntity saved = repository.save(entity);
        log.info("Cancelled disposal of fixed asset {}", assetId);
        return saved.toDomain();
    }

    private FixedAssetEntity load(long assetId) {
        return repository.findByIdAndDeletedFalse(assetId)
            .orElseThrow(() -> NotFoundException.fixedAsset(assetId));
    }

    private static void validateAsset(String name, LocalDate acquisitionDate, int usefulLife, long acquisitionCost) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Asset name is required");
        }
        if (acquisitionDate == null) {
            throw new ValidationException("Acquisition date is required");
        }
        if (usefulLife < 1) {
            throw new ValidationException("Useful life must be at least 1 year, got " + usefulLife);
        }
        if (acquisitionCost < 1) {
            throw new ValidationException("Acquisition cost must be at least 1, got " + acquisitionCost);
        }
    }
}
