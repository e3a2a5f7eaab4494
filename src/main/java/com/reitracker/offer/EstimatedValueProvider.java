package com.reitracker.offer;

import com.reitracker.domain.model.DealSpec;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Source of a property's estimated market value, typically backed by a comparable-sales
 * service. Implementations return empty when no estimate is available for the deal.
 */
public interface EstimatedValueProvider {

    Optional<BigDecimal> estimatedValue(DealSpec deal);
}
