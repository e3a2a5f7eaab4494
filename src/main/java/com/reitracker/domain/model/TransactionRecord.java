package com.reitracker.domain.model;

import com.reitracker.domain.enums.TransactionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** A single ledger entry against an owned property. Amounts are always positive; the type carries the sign. */
@Value
@Builder
public class TransactionRecord {

    String id;
    String propertyId;
    LocalDate date;
    TransactionType type;
    String category;
    BigDecimal amount;
    String description;
}
