package com.reitracker.offer;

import com.reitracker.domain.model.BrrrrDeal;
import com.reitracker.domain.model.DealSpec;
import java.math.BigDecimal;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Estimated value taken from the deal itself: the after-repair value of a BRRRR deal.
 * Other strategies carry no estimate of their own and get none.
 */
@Component
public class AfterRepairValueProvider implements EstimatedValueProvider {

    @Override
    public Optional<BigDecimal> estimatedValue(DealSpec deal) {
        if (deal instanceof BrrrrDeal brrrr) {
            return Optional.of(brrrr.getAfterRepairValue());
        }
        return Optional.empty();
    }
}
