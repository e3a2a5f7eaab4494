package com.reitracker.domain.vo;

import com.reitracker.exception.FieldValidationException;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable terms of one loan in a deal's financing stack.
 *
 * <p>Validated on construction: principal must be present and non-negative, the annual
 * rate must lie within [0, 100] and the term must be at least one month. A term of zero
 * is rejected here so payment math never divides by it.
 */
@Value
public class LoanSpec {

    String name;
    BigDecimal principal;

    /** Annual rate in percent, e.g. 4.5 for 4.5%. */
    BigDecimal annualInterestRate;

    int termMonths;
    BigDecimal downPayment;
    BigDecimal closingCosts;
    boolean interestOnly;

    @Builder(toBuilder = true)
    private LoanSpec(
            String name,
            BigDecimal principal,
            BigDecimal annualInterestRate,
            int termMonths,
            BigDecimal downPayment,
            BigDecimal closingCosts,
            boolean interestOnly) {
        if (principal == null) {
            throw FieldValidationException.required("loan_amount");
        }
        Amounts.requireNonNegative(principal, "loan_amount");
        if (annualInterestRate == null) {
            throw FieldValidationException.required("loan_interest_rate");
        }
        Amounts.requirePercentage(annualInterestRate, "loan_interest_rate");
        if (termMonths <= 0) {
            throw new FieldValidationException("loan_term", "must be positive");
        }
        Amounts.requireNonNegative(downPayment, "loan_down_payment");
        Amounts.requireNonNegative(closingCosts, "loan_closing_costs");

        this.name = name;
        this.principal = principal;
        this.annualInterestRate = annualInterestRate;
        this.termMonths = termMonths;
        this.downPayment = Amounts.orZero(downPayment);
        this.closingCosts = Amounts.orZero(closingCosts);
        this.interestOnly = interestOnly;
    }

    /** Monthly rate as a fraction: annual percent / 12 / 100. */
    public BigDecimal getMonthlyRate() {
        return annualInterestRate.divide(Amounts.TWELVE, Amounts.MC).divide(Amounts.HUNDRED, Amounts.MC);
    }

    /** Cash the buyer brings to close this loan. */
    public BigDecimal getInitialCosts() {
        return downPayment.add(closingCosts);
    }
}
