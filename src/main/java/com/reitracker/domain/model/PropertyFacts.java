package com.reitracker.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Acquisition facts of an owned property, as needed for return-on-investment KPIs.
 * A null {@code purchaseDate} means the since-acquisition window cannot be computed.
 */
@Value
@Builder
public class PropertyFacts {

    String propertyId;
    LocalDate purchaseDate;
    BigDecimal purchasePrice;
    BigDecimal downPayment;
    BigDecimal closingCosts;
    BigDecimal renovationCosts;
    BigDecimal marketingCosts;
    BigDecimal holdingCosts;
}
