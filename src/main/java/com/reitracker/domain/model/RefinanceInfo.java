package com.reitracker.domain.model;

import lombok.Builder;
import lombok.Value;

/** Whether the mortgage payment changed within a KPI window, with the first and last payment seen. */
@Value
@Builder
public class RefinanceInfo {

    boolean hasRefinanced;
    Double originalDebtService;
    Double currentDebtService;

    public static RefinanceInfo none() {
        return RefinanceInfo.builder()
                .hasRefinanced(false)
                .originalDebtService(0.0)
                .currentDebtService(0.0)
                .build();
    }
}
