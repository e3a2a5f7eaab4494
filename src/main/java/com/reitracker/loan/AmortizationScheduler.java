package com.reitracker.loan;

import com.reitracker.domain.model.AmortizationRow;
import com.reitracker.domain.vo.LoanSpec;
import com.reitracker.exception.FieldValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds amortization schedules and answers balance-over-time questions from them.
 */
@Service
@RequiredArgsConstructor
public class AmortizationScheduler {

    private static final Logger log = LoggerFactory.getLogger(AmortizationScheduler.class);

    private final LoanPaymentCalculator loanPaymentCalculator;

    /**
     * Returns the lazily generated schedule for the loan.
     *
     * @throws FieldValidationException if principal is not positive, the rate is negative
     *     or the term is not positive
     */
    public AmortizationSchedule schedule(LoanSpec loan) {
        if (loan.getPrincipal().signum() <= 0) {
            throw new FieldValidationException("loan_amount", "must be positive");
        }
        if (loan.getAnnualInterestRate().signum() < 0) {
            throw new FieldValidationException("loan_interest_rate", "must not be negative");
        }
        if (loan.getTermMonths() <= 0) {
            throw new FieldValidationException("loan_term", "must be positive");
        }
        BigDecimal payment = loanPaymentCalculator.monthlyPayment(loan);
        log.debug("Scheduling {} payments of {} for loan {}", loan.getTermMonths(), payment, loan.getName());
        return new AmortizationSchedule(loan, payment);
    }

    /**
     * Balance after {@code months} payments, found by walking only that many rows.
     * Zero months returns the principal; months past the term return zero.
     */
    public BigDecimal balanceAfter(LoanSpec loan, int months) {
        if (months < 0) {
            throw new FieldValidationException("months", "must not be negative");
        }
        BigDecimal balance = loan.getPrincipal();
        if (months == 0) {
            return balance;
        }
        int walked = 0;
        for (AmortizationRow row : schedule(loan)) {
            balance = row.getRemainingBalance();
            if (++walked == months) {
                break;
            }
        }
        return balance;
    }

    /** Whole months elapsed between the first payment date and {@code asOf}, never negative. */
    public int elapsedPayments(LocalDate start, LocalDate asOf) {
        if (start == null || asOf == null || asOf.isBefore(start)) {
            return 0;
        }
        return (int) ChronoUnit.MONTHS.between(start, asOf);
    }
}
