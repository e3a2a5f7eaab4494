package com.reitracker.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Equity at the end of a projection horizon, split into appreciation and principal paydown. */
@Value
@Builder
public class EquityProjection {

    int years;

    /** Percent per year. */
    BigDecimal annualAppreciationRate;

    BigDecimal purchasePrice;
    BigDecimal initialPropertyValue;
    BigDecimal initialLoanBalance;
    BigDecimal initialEquity;
    BigDecimal finalPropertyValue;
    BigDecimal finalLoanBalance;
    BigDecimal finalEquity;
    BigDecimal equityFromAppreciation;
    BigDecimal equityFromPrincipal;
    BigDecimal totalEquityGain;
}
