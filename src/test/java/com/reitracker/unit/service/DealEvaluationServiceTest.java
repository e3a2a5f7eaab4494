package com.reitracker.unit.service;

import static com.reitracker.unit.DealFixtures.brrrrDeal;
import static com.reitracker.unit.DealFixtures.ltrDeal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.reitracker.analysis.AnalysisEngine;
import com.reitracker.domain.model.DealEvaluation;
import com.reitracker.domain.model.DealSpec;
import com.reitracker.exception.ErrorCode;
import com.reitracker.exception.ResourceNotFoundException;
import com.reitracker.loan.LoanPaymentCalculator;
import com.reitracker.offer.AfterRepairValueProvider;
import com.reitracker.offer.EstimatedValueProvider;
import com.reitracker.offer.MaximumOfferCalculator;
import com.reitracker.offer.OfferConfig;
import com.reitracker.repository.DealRepository;
import com.reitracker.service.DealEvaluationService;
import java.math.BigDecimal;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DealEvaluationServiceTest {

    @Mock
    private DealRepository dealRepository;

    @Mock
    private EstimatedValueProvider estimatedValueProvider;

    private DealEvaluationService service;

    @BeforeEach
    void setUp() {
        AnalysisEngine analysisEngine = new AnalysisEngine(new LoanPaymentCalculator());
        MaximumOfferCalculator maximumOfferCalculator = new MaximumOfferCalculator(analysisEngine, new OfferConfig());
        service = new DealEvaluationService(dealRepository, analysisEngine, maximumOfferCalculator, estimatedValueProvider);
    }

    @Test
    @DisplayName("Stored deal is loaded, analyzed and priced when a value is available")
    void storedDeal_withEstimate() {
        DealSpec deal = brrrrDeal().build();
        when(dealRepository.findById("deal-brrrr")).thenReturn(Optional.of(deal));
        when(estimatedValueProvider.estimatedValue(deal)).thenReturn(Optional.of(new BigDecimal("180000")));

        DealEvaluation evaluation = service.evaluate("deal-brrrr");

        assertThat(evaluation.getReport().getDealId()).isEqualTo("deal-brrrr");
        assertThat(evaluation.getEstimatedValue()).isEqualByComparingTo("180000");
        assertThat(evaluation.getMaxOffer().getMaxOffer()).isEqualByComparingTo("106200");
    }

    @Test
    @DisplayName("No estimated value means no offer")
    void noEstimate_noOffer() {
        when(estimatedValueProvider.estimatedValue(any())).thenReturn(Optional.empty());

        DealEvaluation evaluation = service.evaluate(ltrDeal());

        assertThat(evaluation.getReport().getMonthlyCashFlow()).isEqualByComparingTo("44.30");
        assertThat(evaluation.getMaxOffer()).isNull();
        assertThat(evaluation.getEstimatedValue()).isNull();
    }

    @Test
    @DisplayName("Unknown deal id is a not-found error")
    void unknownDeal_notFound() {
        when(dealRepository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.evaluate("missing"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("missing")
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NOT_FOUND);
        verify(estimatedValueProvider, never()).estimatedValue(any());
    }

    @Test
    @DisplayName("After-repair value serves as the estimate for BRRRR deals only")
    void afterRepairValueProvider() {
        AfterRepairValueProvider provider = new AfterRepairValueProvider();

        assertThat(provider.estimatedValue(brrrrDeal().build())).contains(new BigDecimal("180000"));
        assertThat(provider.estimatedValue(ltrDeal())).isEmpty();
    }
}
