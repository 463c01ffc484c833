package com.flagship.bookkeeping.ledger;

import lombok.Value;

/**
 * A registered business partner. Names need not be unique; journal entries
 * refer to counterparties by free text, not by id.
 */
@Value
public class Counterparty {
    Long id;
    String name;
    String code;
    String contactInfo;
    String notes;
    boolean active;
}
