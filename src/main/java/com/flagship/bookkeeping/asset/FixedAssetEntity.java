package com.flagship.bookkeeping.asset;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * JPA entity for the fixed-asset register.
 *
 * No setters: changes go through {@link #updateFrom}, {@link #dispose}, {@link #cancelDisposal}
 * and {@link #markDeleted}, so disposal fields always move together.
 * Timestamps are handled by the lifecycle hooks.
 */
@Entity
@Table(
    name = "fixed_assets",
    indexes = {
        @Index(name = "idx_fixed_assets_deleted", columnList = "is_deleted")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FixedAssetEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "acquisition_date", nullable = false)
    private LocalDate acquisitionDate;

    @Column(name = "useful_life", nullable = false)
    private int usefulLife;

    @Column(name = "acquisition_cost", nullable = false)
    private long acquisitionCost;

    @Enumerated(EnumType.STRING)
    @Column(name = "depreciation_method", nullable = false, length = 20)
    private DepreciationMethod depreciationMethod;

    @Column(nullable = false)
    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(name = "disposal_type", length = 16)
    private DisposalType disposalType;

    @Column(name = "disposal_date")
    private LocalDate disposalDate;

    @Column(name = "disposal_proceeds")
    private Long disposalProceeds;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * The only way to create a new register row. Disposal starts empty.
     */
    static FixedAssetEntity newAsset(String name, LocalDate acquisitionDate, int usefulLife,
                                     long acquisitionCost, String notes) {
        return new FixedAssetEntity(
            null,
            name,
            acquisitionDate,
            usefulLife,
            acquisitionCost,
            DepreciationMethod.STRAIGHT_LINE,
            notes != null ? notes : "",
            null,
            null,
            null,
            false,
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public FixedAsset toDomain() {
        return new FixedAsset(
            id,
            name,
            acquisitionDate,
            usefulLife,
            acquisitionCost,
            depreciationMethod,
            notes,
            disposalType,
            disposalDate,
            disposalProceeds
        );
    }

    void updateFrom(String name, LocalDate acquisitionDate, int usefulLife, long acquisitionCost, String notes) {
        this.name = name;
        this.acquisitionDate = acquisitionDate;
        this.usefulLife = usefulLife;
        this.acquisitionCost = acquisitionCost;
        this.notes = notes != null ? notes : "";
    }

    void dispose(DisposalType type, LocalDate date, Long proceeds) {
        this.disposalType = type;
        this.disposalDate = date;
        this.disposalProceeds = type == DisposalType.SALE ? proceeds : null;
    }

    void cancelDisposal() {
        this.disposalType = null;
        this.disposalDate = null;
        this.disposalProceeds = null;
    }

    void markDeleted() {
        this.deleted = true;
    }
}
