package com.flagship.bookkeeping.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.bookkeeping.common.exception.ValidationException;

/**
 * Consumption-tax classification of a transaction, with its statutory rate in percent.
 *
 * The label is what is stored in the database and exchanged over JSON.
 */
public enum TaxClassification {
    STANDARD("10%", 10),
    REDUCED("8%", 8),
    NON_TAXABLE("non-taxable", 0),
    OUT_OF_SCOPE("out-of-scope", 0);

    private final String label;
    private final int rate;

    TaxClassification(String label, int rate) {
        this.label = label;
        this.rate = rate;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getRate() {
        return rate;
    }

    /**
     * Resolves a classification from its label ("10%", "non-taxable", ...) or its enum name.
     *
     * @throws ValidationException if the value matches neither
     */
    @JsonCreator
    public static TaxClassification fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Tax classification is required");
        }
        String trimmed = value.trim();
        for (TaxClassification classification : values()) {
            if (classification.label.equalsIgnoreCase(trimmed) || classification.name().equalsIgnoreCase(trimmed)) {
                return classification;
            }
        }
        throw new ValidationException("Unknown tax classification: " + value);
    }
}
