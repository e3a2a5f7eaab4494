package com.reitracker.domain.vo;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** One row of a multifamily unit mix, e.g. eight 2BR units renting at 1,150. */
@Value
@Builder
public class UnitType {

    /** Label such as "Studio", "1BR", "2BR". */
    String type;

    int count;
    int occupied;
    Integer squareFootage;
    BigDecimal rent;

    public BigDecimal getPotentialRent() {
        return Amounts.orZero(rent).multiply(BigDecimal.valueOf(count));
    }
}
