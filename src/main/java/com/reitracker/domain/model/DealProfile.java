package com.reitracker.domain.model;

import com.reitracker.domain.vo.LoanSpec;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Facts shared by every strategy variant: identity, the property itself, acquisition costs,
 * income and expense drivers, and the common loan slots.
 *
 * <p>Money fields are dollars; percentage fields are whole percents (8 means 8%). Annual
 * figures are marked as such, everything else is monthly. Strategy-specific fields live on
 * the {@link DealSpec} variants, which also enforce which of the optional fields below are
 * required for that strategy.
 */
@Value
@Builder(toBuilder = true)
public class DealProfile {

    String id;
    String userId;
    String analysisName;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;

    // Property
    String address;
    Integer squareFootage;
    Integer lotSize;
    Integer yearBuilt;
    Integer bedrooms;
    BigDecimal bathrooms;

    // Acquisition
    BigDecimal purchasePrice;
    BigDecimal closingCosts;
    BigDecimal renovationCosts;
    Integer renovationDurationMonths;
    BigDecimal furnishingCosts;
    BigDecimal cashToSeller;
    BigDecimal assignmentFee;
    BigDecimal marketingCosts;

    // Income
    BigDecimal monthlyRent;

    // Fixed expenses
    /** Annual. */
    BigDecimal propertyTaxes;
    /** Annual. */
    BigDecimal insurance;

    BigDecimal hoaCoaCoop;
    BigDecimal utilities;
    BigDecimal internet;
    BigDecimal cleaning;
    BigDecimal pestControl;
    BigDecimal landscaping;

    // Percentage-of-income expenses
    BigDecimal managementFeePercentage;
    BigDecimal capexPercentage;
    BigDecimal vacancyPercentage;
    BigDecimal repairsPercentage;

    // Financing
    LoanSpec initialLoan;
    LoanSpec loan1;
    LoanSpec loan2;
    LoanSpec loan3;

    boolean hasBalloonPayment;
    LocalDate balloonDueDate;
    BigDecimal balloonRefinanceLtvPercentage;
    LoanSpec balloonRefinanceLoan;

    String notes;
}
