package com.reitracker.unit.offer;

import static com.reitracker.unit.DealFixtures.brrrrDeal;
import static com.reitracker.unit.DealFixtures.loan;
import static com.reitracker.unit.DealFixtures.ltrProfile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.reitracker.analysis.AnalysisEngine;
import com.reitracker.domain.model.BrrrrDeal;
import com.reitracker.domain.model.DealSpec;
import com.reitracker.domain.model.LongTermRentalDeal;
import com.reitracker.domain.model.MaxOfferResult;
import com.reitracker.exception.FieldValidationException;
import com.reitracker.loan.LoanPaymentCalculator;
import com.reitracker.offer.MaximumOfferCalculator;
import com.reitracker.offer.OfferConfig;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MaximumOfferCalculator.
 *
 * <p>Reference BRRRR: renovation 30,000, closing 3,000, holding 1,450/month for 4 months.
 * At 180,000 and 75% LTV: 135,000 - 30,000 - 3,000 - 5,800 + 10,000 = 106,200.
 */
class MaximumOfferCalculatorTest {

    private static final BigDecimal ARV = new BigDecimal("180000");

    private MaximumOfferCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new MaximumOfferCalculator(new AnalysisEngine(new LoanPaymentCalculator()), new OfferConfig());
    }

    @Nested
    @DisplayName("Offer formula")
    class OfferFormula {

        @Test
        @DisplayName("Default LTV and target cash left")
        void defaults() {
            MaxOfferResult result = calculator.maxOffer(ARV, brrrrDeal().build());

            assertThat(result.getLtvPercentage()).isEqualByComparingTo("75");
            assertThat(result.getLoanAmount()).isEqualByComparingTo("135000");
            assertThat(result.getMonthlyHoldingCosts()).isEqualByComparingTo("1450");
            assertThat(result.getTotalHoldingCosts()).isEqualByComparingTo("5800");
            assertThat(result.getTargetCashLeft()).isEqualByComparingTo("10000");
            assertThat(result.getMaxOffer()).isEqualByComparingTo("106200");
            assertThat(result.isViable()).isTrue();
        }

        @Test
        @DisplayName("BRRRR refinance LTV overrides the default")
        void brrrrLtv_overrides() {
            BrrrrDeal deal = brrrrDeal().refinanceLtvPercentage(new BigDecimal("70")).build();

            MaxOfferResult result = calculator.maxOffer(ARV, deal, BigDecimal.ZERO);

            // 126,000 - 38,800
            assertThat(result.getLoanAmount()).isEqualByComparingTo("126000");
            assertThat(result.getMaxOffer()).isEqualByComparingTo("87200");
        }

        @Test
        @DisplayName("Balloon refinance LTV applies to balloon deals")
        void balloonLtv_applies() {
            DealSpec deal = LongTermRentalDeal.builder()
                    .profile(ltrProfile()
                            .initialLoan(null)
                            .hasBalloonPayment(true)
                            .balloonRefinanceLtvPercentage(new BigDecimal("80"))
                            .balloonRefinanceLoan(loan("80000", "6", 360))
                            .build())
                    .build();

            MaxOfferResult result = calculator.maxOffer(new BigDecimal("100000"), deal, BigDecimal.ZERO);

            // LTR without renovation: holding months default to zero
            assertThat(result.getLtvPercentage()).isEqualByComparingTo("80");
            assertThat(result.getMaxOffer()).isEqualByComparingTo("80000");
        }

        @Test
        @DisplayName("Non-BRRRR strategies carry interest on loan 1")
        void otherStrategies_useLoan1() {
            DealSpec deal = LongTermRentalDeal.builder()
                    .profile(ltrProfile()
                            .propertyTaxes(null)
                            .insurance(null)
                            .renovationCosts(new BigDecimal("10000"))
                            .renovationDurationMonths(2)
                            .loan1(loan("60000", "12", 12))
                            .build())
                    .build();

            MaxOfferResult result = calculator.maxOffer(new BigDecimal("100000"), deal, BigDecimal.ZERO);

            // 600/month interest on loan 1 over 2 months; the initial loan is ignored
            assertThat(result.getTotalHoldingCosts()).isEqualByComparingTo("1200");
            assertThat(result.getMaxOffer()).isEqualByComparingTo("63800");
        }
    }

    @Nested
    @DisplayName("Clamping and validation")
    class ClampingAndValidation {

        @Test
        @DisplayName("Renovation above the loan amount clamps the offer to exactly zero")
        void renovationExceedsLoan_clampedToZero() {
            BrrrrDeal base = brrrrDeal().build();
            BrrrrDeal deal = brrrrDeal()
                    .profile(base.getProfile().toBuilder().renovationCosts(new BigDecimal("200000")).build())
                    .build();

            MaxOfferResult result = calculator.maxOffer(ARV, deal, BigDecimal.ZERO);

            assertThat(result.getMaxOffer()).isEqualByComparingTo("0");
            assertThat(result.getRawOffer()).isNegative();
            assertThat(result.isViable()).isFalse();
        }

        @Test
        @DisplayName("Offer is never negative, even for a zero estimated value")
        void zeroValue_neverNegative() {
            MaxOfferResult result = calculator.maxOffer(BigDecimal.ZERO, brrrrDeal().build(), BigDecimal.ZERO);

            assertThat(result.getMaxOffer()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Missing estimated value fails on estimated_value")
        void missingValue_rejected() {
            assertThatThrownBy(() -> calculator.maxOffer(null, brrrrDeal().build()))
                    .isInstanceOf(FieldValidationException.class)
                    .hasFieldOrPropertyWithValue("field", "estimated_value");
        }

        @Test
        @DisplayName("Negative estimated value is rejected")
        void negativeValue_rejected() {
            assertThatThrownBy(() -> calculator.maxOffer(new BigDecimal("-1"), brrrrDeal().build()))
                    .isInstanceOf(FieldValidationException.class);
        }
    }
}
