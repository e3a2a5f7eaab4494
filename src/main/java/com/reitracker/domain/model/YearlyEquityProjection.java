package com.reitracker.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Position at the end of one projection year. The two {@code equityFrom*} fields are cumulative. */
@Value
@Builder
public class YearlyEquityProjection {

    int year;
    BigDecimal propertyValue;
    BigDecimal loanBalance;
    BigDecimal equity;
    BigDecimal equityFromAppreciation;
    BigDecimal equityFromPrincipal;
    BigDecimal annualAppreciation;
}
