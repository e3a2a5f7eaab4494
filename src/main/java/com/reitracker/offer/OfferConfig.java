package com.reitracker.offer;

import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Maximum allowable offer defaults, prefix {@code rei.offer.*}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>defaultLtvPercentage: 75 (typical refinance lender limit)</li>
 *   <li>defaultTargetCashLeft: 10000 (cash the investor is willing to leave in the deal)</li>
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "rei.offer")
public class OfferConfig {

    private BigDecimal defaultLtvPercentage = new BigDecimal("75");
    private BigDecimal defaultTargetCashLeft = new BigDecimal("10000");
}
