package com.reitracker.domain.model;

import com.reitracker.domain.enums.ConfidenceLevel;
import lombok.Builder;
import lombok.Value;

/**
 * Operating KPIs for one property over one date window.
 *
 * <p>Every number is a plain {@code Double} that has been through
 * {@link com.reitracker.kpi.NumberSanitizer}, so it is either finite or null. Ratios whose
 * denominator is zero are null rather than zero.
 */
@Value
@Builder
public class KpiResult {

    PeriodAmount netOperatingIncome;
    PeriodAmount totalIncome;
    PeriodAmount totalExpenses;

    /** Percent. */
    Double capRate;

    /** Percent. */
    Double cashOnCashReturn;

    Double debtServiceCoverageRatio;
    Double cashInvested;
    KpiMetadata metadata;

    /** Zero-valued result for a window with no usable data. */
    public static KpiResult empty() {
        return KpiResult.builder()
                .netOperatingIncome(PeriodAmount.zero())
                .totalIncome(PeriodAmount.zero())
                .totalExpenses(PeriodAmount.zero())
                .capRate(0.0)
                .cashOnCashReturn(0.0)
                .debtServiceCoverageRatio(0.0)
                .cashInvested(0.0)
                .metadata(KpiMetadata.builder()
                        .hasCompleteHistory(false)
                        .confidenceLevel(ConfidenceLevel.LOW)
                        .refinanceInfo(RefinanceInfo.none())
                        .build())
                .build();
    }
}
