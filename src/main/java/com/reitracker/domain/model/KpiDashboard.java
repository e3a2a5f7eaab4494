package com.reitracker.domain.model;

import lombok.Builder;
import lombok.Value;

/** Year-to-date and since-acquisition KPIs for one property. */
@Value
@Builder
public class KpiDashboard {

    KpiResult yearToDate;
    KpiResult sinceAcquisition;
    Metadata metadata;

    @Value
    public static class Metadata {
        boolean hasCompleteHistory;
        String propertyId;
    }
}
