package com.reitracker.loan;

import com.reitracker.domain.vo.Amounts;
import com.reitracker.domain.vo.LoanSpec;
import com.reitracker.exception.FieldValidationException;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Level-payment loan math.
 *
 * <p>Three payment shapes are supported:
 * <ul>
 *   <li><b>Interest-only:</b> principal x monthly rate, principal due at maturity</li>
 *   <li><b>Zero rate:</b> principal / term, exact</li>
 *   <li><b>Amortizing:</b> P x r(1+r)^n / ((1+r)^n - 1)</li>
 * </ul>
 *
 * <p>Results are unrounded {@link Amounts#MC} values. Callers round when they publish.
 */
@Service
public class LoanPaymentCalculator {

    private static final Logger log = LoggerFactory.getLogger(LoanPaymentCalculator.class);

    /**
     * Returns the scheduled monthly payment for the loan.
     *
     * @param loan validated loan terms
     * @return monthly payment, unrounded
     */
    public BigDecimal monthlyPayment(LoanSpec loan) {
        BigDecimal principal = loan.getPrincipal();
        BigDecimal monthlyRate = loan.getMonthlyRate();

        BigDecimal payment;
        if (loan.isInterestOnly()) {
            payment = principal.multiply(monthlyRate, Amounts.MC);
        } else if (monthlyRate.signum() == 0) {
            payment = principal.divide(BigDecimal.valueOf(loan.getTermMonths()), Amounts.MC);
        } else {
            BigDecimal growth = BigDecimal.ONE.add(monthlyRate).pow(loan.getTermMonths(), Amounts.MC);
            payment = principal
                    .multiply(monthlyRate.multiply(growth, Amounts.MC), Amounts.MC)
                    .divide(growth.subtract(BigDecimal.ONE), Amounts.MC);
        }

        log.debug(
                "Monthly payment for loan {}: principal={}, rate={}%, term={}, interestOnly={} -> {}",
                loan.getName(),
                principal,
                loan.getAnnualInterestRate(),
                loan.getTermMonths(),
                loan.isInterestOnly(),
                payment);
        return payment;
    }

    /** One month of interest on the full principal, i.e. the interest-only carry. */
    public BigDecimal monthlyInterest(LoanSpec loan) {
        return loan.getPrincipal().multiply(loan.getMonthlyRate(), Amounts.MC);
    }

    /**
     * Outstanding principal after {@code paymentsMade} scheduled payments, in closed form.
     *
     * @throws FieldValidationException if {@code paymentsMade} is negative
     */
    public BigDecimal remainingBalance(LoanSpec loan, int paymentsMade) {
        if (paymentsMade < 0) {
            throw new FieldValidationException("payments_made", "must not be negative");
        }
        int term = loan.getTermMonths();
        BigDecimal principal = loan.getPrincipal();
        if (paymentsMade >= term) {
            return BigDecimal.ZERO;
        }
        if (paymentsMade == 0 || loan.isInterestOnly()) {
            return principal;
        }

        BigDecimal monthlyRate = loan.getMonthlyRate();
        if (monthlyRate.signum() == 0) {
            return principal
                    .multiply(BigDecimal.valueOf(term - paymentsMade), Amounts.MC)
                    .divide(BigDecimal.valueOf(term), Amounts.MC);
        }

        // B_p = P(1+r)^p - M((1+r)^p - 1) / r
        BigDecimal growth = BigDecimal.ONE.add(monthlyRate).pow(paymentsMade, Amounts.MC);
        BigDecimal paidDown = monthlyPayment(loan)
                .multiply(growth.subtract(BigDecimal.ONE), Amounts.MC)
                .divide(monthlyRate, Amounts.MC);
        BigDecimal balance = principal.multiply(growth, Amounts.MC).subtract(paidDown, Amounts.MC);
        return balance.signum() < 0 ? BigDecimal.ZERO : balance;
    }
}
