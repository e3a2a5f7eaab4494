package com.reitracker.domain.model;

import lombok.Value;

/** A monthly average and its annualized (x12) value. */
@Value
public class PeriodAmount {

    Double monthly;
    Double annual;

    public static PeriodAmount zero() {
        return new PeriodAmount(0.0, 0.0);
    }
}
