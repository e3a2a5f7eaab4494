package com.reitracker.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Maximum allowable offer with every intermediate that produced it.
 *
 * <p>{@code maxOffer} is never negative. When the unclamped figure would have been negative
 * it is clamped to zero and {@code viable} is false; {@code rawOffer} keeps the unclamped value.
 */
@Value
@Builder
public class MaxOfferResult {

    BigDecimal estimatedValue;
    BigDecimal ltvPercentage;
    BigDecimal loanAmount;
    BigDecimal renovationCosts;
    BigDecimal closingCosts;
    BigDecimal monthlyHoldingCosts;
    BigDecimal totalHoldingCosts;
    BigDecimal targetCashLeft;
    BigDecimal rawOffer;
    BigDecimal maxOffer;
    boolean viable;
}
