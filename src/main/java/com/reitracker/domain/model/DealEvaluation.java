package com.reitracker.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Analysis of a deal plus, when an estimated value was available, its offer ceiling. */
@Value
@Builder
public class DealEvaluation {

    AnalysisReport report;

    /** Null when no estimated value was available. */
    BigDecimal estimatedValue;

    /** Null when no estimated value was available. */
    MaxOfferResult maxOffer;
}
