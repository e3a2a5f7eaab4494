package com.reitracker.domain.model;

import com.reitracker.domain.enums.ConfidenceLevel;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class KpiMetadata {

    boolean hasCompleteHistory;
    ConfidenceLevel confidenceLevel;
    RefinanceInfo refinanceInfo;
}
