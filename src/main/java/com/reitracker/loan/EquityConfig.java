package com.reitracker.loan;

import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Equity projection defaults, prefix {@code rei.equity.*}.
 *
 * <p>Defaults: 3% annual appreciation, 30-year horizon.
 */
@Data
@Component
@ConfigurationProperties(prefix = "rei.equity")
public class EquityConfig {

    private BigDecimal defaultAppreciationRate = new BigDecimal("3");
    private int defaultProjectionYears = 30;
}
