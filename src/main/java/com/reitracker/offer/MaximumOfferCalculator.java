package com.reitracker.offer;

import com.reitracker.analysis.AnalysisEngine;
import com.reitracker.domain.model.BrrrrDeal;
import com.reitracker.domain.model.DealProfile;
import com.reitracker.domain.model.DealSpec;
import com.reitracker.domain.model.MaxOfferResult;
import com.reitracker.domain.vo.Amounts;
import com.reitracker.exception.FieldValidationException;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes the maximum allowable offer (MAO): the highest purchase price at which a
 * refinance at the chosen loan-to-value still returns all but {@code targetCashLeft}
 * of the investor's cash.
 *
 * <pre>
 * loanAmount = estimatedValue x ltv / 100
 * offer      = loanAmount - renovation - closing - holdingCosts + targetCashLeft
 * </pre>
 *
 * <p>LTV comes from the BRRRR refinance LTV when set, otherwise the balloon refinance LTV
 * for balloon deals, otherwise the configured default. The offer is clamped at zero.
 */
@Service
public class MaximumOfferCalculator {

    private static final Logger log = LoggerFactory.getLogger(MaximumOfferCalculator.class);

    private final AnalysisEngine analysisEngine;
    private final OfferConfig offerConfig;

    public MaximumOfferCalculator(AnalysisEngine analysisEngine, OfferConfig offerConfig) {
        this.analysisEngine = analysisEngine;
        this.offerConfig = offerConfig;
    }

    /** MAO using the configured default target cash left. */
    public MaxOfferResult maxOffer(BigDecimal estimatedValue, DealSpec deal) {
        return maxOffer(estimatedValue, deal, offerConfig.getDefaultTargetCashLeft());
    }

    /**
     * Computes the MAO for the deal.
     *
     * @param estimatedValue market or after-repair value the refinance is sized against
     * @param deal           the deal whose costs are deducted
     * @param targetCashLeft cash the investor accepts leaving in the deal; null means zero
     * @return the offer and its components, never negative
     * @throws FieldValidationException if the estimated value is missing or negative
     */
    public MaxOfferResult maxOffer(BigDecimal estimatedValue, DealSpec deal, BigDecimal targetCashLeft) {
        if (estimatedValue == null) {
            throw FieldValidationException.required("estimated_value");
        }
        Amounts.requireNonNegative(estimatedValue, "estimated_value");

        DealProfile profile = deal.getProfile();
        BigDecimal ltv = resolveLtv(deal);
        BigDecimal loanAmount = Amounts.percentOf(estimatedValue, ltv);
        BigDecimal renovationCosts = Amounts.orZero(profile.getRenovationCosts());
        BigDecimal closingCosts = Amounts.orZero(profile.getClosingCosts());
        BigDecimal monthlyHoldingCosts = analysisEngine.monthlyHoldingCosts(deal);
        BigDecimal totalHoldingCosts = analysisEngine.holdingCosts(deal);
        BigDecimal cashLeft = Amounts.orZero(targetCashLeft);

        BigDecimal rawOffer = loanAmount
                .subtract(renovationCosts)
                .subtract(closingCosts)
                .subtract(totalHoldingCosts)
                .add(cashLeft);
        boolean viable = rawOffer.signum() >= 0;
        BigDecimal offer = viable ? rawOffer : BigDecimal.ZERO;

        log.debug(
                "MAO for deal {}: value={}, ltv={}%, loan={}, renovation={}, closing={}, holding={}, cashLeft={} -> {}",
                deal.getId(), estimatedValue, ltv, loanAmount, renovationCosts, closingCosts,
                totalHoldingCosts, cashLeft, rawOffer);

        return MaxOfferResult.builder()
                .estimatedValue(estimatedValue)
                .ltvPercentage(ltv)
                .loanAmount(Amounts.cents(loanAmount))
                .renovationCosts(Amounts.cents(renovationCosts))
                .closingCosts(Amounts.cents(closingCosts))
                .monthlyHoldingCosts(Amounts.cents(monthlyHoldingCosts))
                .totalHoldingCosts(Amounts.cents(totalHoldingCosts))
                .targetCashLeft(Amounts.cents(cashLeft))
                .rawOffer(Amounts.cents(rawOffer))
                .maxOffer(Amounts.cents(offer))
                .viable(viable)
                .build();
    }

    private BigDecimal resolveLtv(DealSpec deal) {
        if (deal instanceof BrrrrDeal brrrr && brrrr.getRefinanceLtvPercentage() != null) {
            return brrrr.getRefinanceLtvPercentage();
        }
        DealProfile profile = deal.getProfile();
        if (profile.isHasBalloonPayment() && profile.getBalloonRefinanceLtvPercentage() != null) {
            return profile.getBalloonRefinanceLtvPercentage();
        }
        return offerConfig.getDefaultLtvPercentage();
    }
}
