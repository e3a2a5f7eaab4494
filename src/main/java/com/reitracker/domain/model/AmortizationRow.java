package com.reitracker.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** One month of a loan's amortization schedule. Amounts are unrounded. */
@Value
@Builder
public class AmortizationRow {

    /** 1-based payment number. */
    int month;

    BigDecimal payment;
    BigDecimal principal;
    BigDecimal interest;
    BigDecimal remainingBalance;
    BigDecimal cumulativeInterest;
    BigDecimal cumulativePrincipal;
}
