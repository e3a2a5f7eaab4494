package com.reitracker.service;

import com.reitracker.analysis.AnalysisEngine;
import com.reitracker.domain.model.AnalysisReport;
import com.reitracker.domain.model.DealEvaluation;
import com.reitracker.domain.model.DealSpec;
import com.reitracker.domain.model.MaxOfferResult;
import com.reitracker.exception.ResourceNotFoundException;
import com.reitracker.offer.EstimatedValueProvider;
import com.reitracker.offer.MaximumOfferCalculator;
import com.reitracker.repository.DealRepository;
import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Full evaluation of a stored or in-memory deal: the analysis report plus, when the
 * {@link EstimatedValueProvider} has a value for the deal, the maximum allowable offer.
 */
@Service
public class DealEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(DealEvaluationService.class);

    private final DealRepository dealRepository;
    private final AnalysisEngine analysisEngine;
    private final MaximumOfferCalculator maximumOfferCalculator;
    private final EstimatedValueProvider estimatedValueProvider;

    public DealEvaluationService(
            DealRepository dealRepository,
            AnalysisEngine analysisEngine,
            MaximumOfferCalculator maximumOfferCalculator,
            EstimatedValueProvider estimatedValueProvider) {
        this.dealRepository = dealRepository;
        this.analysisEngine = analysisEngine;
        this.maximumOfferCalculator = maximumOfferCalculator;
        this.estimatedValueProvider = estimatedValueProvider;
    }

    /**
     * Loads and evaluates a stored deal.
     *
     * @throws ResourceNotFoundException if no deal has the given id
     */
    public DealEvaluation evaluate(String dealId) {
        DealSpec deal = dealRepository
                .findById(dealId)
                .orElseThrow(() -> new ResourceNotFoundException("Deal", dealId));
        return evaluate(deal);
    }

    public DealEvaluation evaluate(DealSpec deal) {
        AnalysisReport report = analysisEngine.analyze(deal);
        Optional<BigDecimal> estimatedValue = estimatedValueProvider.estimatedValue(deal);
        MaxOfferResult maxOffer = estimatedValue
                .map(value -> maximumOfferCalculator.maxOffer(value, deal))
                .orElse(null);

        if (maxOffer == null) {
            log.debug("No estimated value for deal {}, skipping offer calculation", deal.getId());
        }

        return DealEvaluation.builder()
                .report(report)
                .estimatedValue(estimatedValue.orElse(null))
                .maxOffer(maxOffer)
                .build();
    }
}
