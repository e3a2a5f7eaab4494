package com.reitracker.loan;

import com.reitracker.domain.model.EquityProjection;
import com.reitracker.domain.model.YearlyEquityProjection;
import com.reitracker.domain.vo.Amounts;
import com.reitracker.domain.vo.LoanSpec;
import com.reitracker.exception.FieldValidationException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Projects equity growth from compound appreciation and scheduled principal paydown.
 *
 * <p>The loan is optional: without one the whole property value is equity and only
 * appreciation contributes. {@code paymentsMade} positions the projection on the loan's
 * schedule, so a loan already five years in starts from its year-five balance.
 */
@Service
public class EquityProjectionCalculator {

    private static final Logger log = LoggerFactory.getLogger(EquityProjectionCalculator.class);

    private final LoanPaymentCalculator loanPaymentCalculator;
    private final EquityConfig equityConfig;

    public EquityProjectionCalculator(LoanPaymentCalculator loanPaymentCalculator, EquityConfig equityConfig) {
        this.loanPaymentCalculator = loanPaymentCalculator;
        this.equityConfig = equityConfig;
    }

    /** Projection over the configured default horizon at the configured appreciation rate. */
    public EquityProjection project(BigDecimal purchasePrice, BigDecimal currentValue, LoanSpec loan, int paymentsMade) {
        return project(purchasePrice, currentValue, loan, paymentsMade, null, equityConfig.getDefaultProjectionYears());
    }

    /**
     * Equity position after {@code years} years.
     *
     * @param purchasePrice        original purchase price
     * @param currentValue         today's value; the purchase price is used when null
     * @param loan                 outstanding loan, or null for a free-and-clear property
     * @param paymentsMade         payments already made on the loan
     * @param annualAppreciationRate percent per year; the configured default when null
     * @param years                projection horizon, zero or more
     */
    public EquityProjection project(
            BigDecimal purchasePrice,
            BigDecimal currentValue,
            LoanSpec loan,
            int paymentsMade,
            BigDecimal annualAppreciationRate,
            int years) {
        if (years < 0) {
            throw new FieldValidationException("projection_years", "must not be negative");
        }
        BigDecimal startValue = resolveStartValue(purchasePrice, currentValue);
        BigDecimal rate = resolveRate(annualAppreciationRate);

        BigDecimal initialBalance = balance(loan, paymentsMade);
        BigDecimal finalBalance = balance(loan, paymentsMade + years * 12);
        BigDecimal finalValue = appreciate(startValue, rate, years);

        BigDecimal fromAppreciation = finalValue.subtract(startValue);
        BigDecimal fromPrincipal = initialBalance.subtract(finalBalance);

        log.debug(
                "Equity projection over {}y at {}%: value {} -> {}, balance {} -> {}",
                years, rate, startValue, finalValue, initialBalance, finalBalance);

        return EquityProjection.builder()
                .years(years)
                .annualAppreciationRate(rate)
                .purchasePrice(purchasePrice)
                .initialPropertyValue(startValue)
                .initialLoanBalance(initialBalance)
                .initialEquity(startValue.subtract(initialBalance))
                .finalPropertyValue(finalValue)
                .finalLoanBalance(finalBalance)
                .finalEquity(finalValue.subtract(finalBalance))
                .equityFromAppreciation(fromAppreciation)
                .equityFromPrincipal(fromPrincipal)
                .totalEquityGain(fromAppreciation.add(fromPrincipal))
                .build();
    }

    /** One entry per projection year, year 1 through {@code years}. */
    public List<YearlyEquityProjection> yearly(
            BigDecimal purchasePrice,
            BigDecimal currentValue,
            LoanSpec loan,
            int paymentsMade,
            BigDecimal annualAppreciationRate,
            int years) {
        if (years < 0) {
            throw new FieldValidationException("projection_years", "must not be negative");
        }
        BigDecimal startValue = resolveStartValue(purchasePrice, currentValue);
        BigDecimal rate = resolveRate(annualAppreciationRate);
        BigDecimal initialBalance = balance(loan, paymentsMade);

        List<YearlyEquityProjection> projections = new ArrayList<>(years);
        BigDecimal value = startValue;
        for (int year = 1; year <= years; year++) {
            BigDecimal previousValue = value;
            value = appreciate(value, rate, 1);
            BigDecimal loanBalance = balance(loan, paymentsMade + year * 12);
            projections.add(YearlyEquityProjection.builder()
                    .year(year)
                    .propertyValue(value)
                    .loanBalance(loanBalance)
                    .equity(value.subtract(loanBalance))
                    .equityFromAppreciation(value.subtract(startValue))
                    .equityFromPrincipal(initialBalance.subtract(loanBalance))
                    .annualAppreciation(value.subtract(previousValue))
                    .build());
        }
        return projections;
    }

    private BigDecimal resolveStartValue(BigDecimal purchasePrice, BigDecimal currentValue) {
        BigDecimal startValue = currentValue != null ? currentValue : purchasePrice;
        if (startValue == null) {
            throw FieldValidationException.required("purchase_price");
        }
        return startValue;
    }

    private BigDecimal resolveRate(BigDecimal annualAppreciationRate) {
        return annualAppreciationRate != null ? annualAppreciationRate : equityConfig.getDefaultAppreciationRate();
    }

    private BigDecimal balance(LoanSpec loan, int paymentsMade) {
        return loan == null ? BigDecimal.ZERO : loanPaymentCalculator.remainingBalance(loan, paymentsMade);
    }

    private static BigDecimal appreciate(BigDecimal value, BigDecimal ratePercent, int years) {
        BigDecimal factor = BigDecimal.ONE.add(ratePercent.divide(Amounts.HUNDRED, Amounts.MC));
        return value.multiply(factor.pow(years, Amounts.MC), Amounts.MC);
    }
}
