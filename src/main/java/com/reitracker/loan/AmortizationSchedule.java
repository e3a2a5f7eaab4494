package com.reitracker.loan;

import com.reitracker.domain.model.AmortizationRow;
import com.reitracker.domain.vo.Amounts;
import com.reitracker.domain.vo.LoanSpec;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Month-by-month amortization of a loan, generated on demand.
 *
 * <p>Nothing is precomputed: each {@link #iterator()} starts again at month 1 and yields the
 * same rows, so a 360-month schedule can be scanned for a prefix without materializing it.
 * The last row absorbs rounding drift so that the remaining balance ends at exactly zero.
 */
public final class AmortizationSchedule implements Iterable<AmortizationRow> {

    private final LoanSpec loan;
    private final BigDecimal payment;

    AmortizationSchedule(LoanSpec loan, BigDecimal payment) {
        this.loan = loan;
        this.payment = payment;
    }

    public LoanSpec getLoan() {
        return loan;
    }

    /** Scheduled payment for every row except possibly the last. */
    public BigDecimal getPayment() {
        return payment;
    }

    public int size() {
        return loan.getTermMonths();
    }

    @Override
    public Iterator<AmortizationRow> iterator() {
        return new RowIterator();
    }

    public Stream<AmortizationRow> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /** Materializes the full schedule. */
    public List<AmortizationRow> rows() {
        List<AmortizationRow> rows = new ArrayList<>(size());
        forEach(rows::add);
        return rows;
    }

    private final class RowIterator implements Iterator<AmortizationRow> {

        private final BigDecimal monthlyRate = loan.getMonthlyRate();
        private int month;
        private BigDecimal balance = loan.getPrincipal();
        private BigDecimal cumulativeInterest = BigDecimal.ZERO;
        private BigDecimal cumulativePrincipal = BigDecimal.ZERO;

        @Override
        public boolean hasNext() {
            return month < loan.getTermMonths();
        }

        @Override
        public AmortizationRow next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            month++;
            BigDecimal interest = balance.multiply(monthlyRate, Amounts.MC);
            BigDecimal rowPayment;
            BigDecimal principal;
            if (month == loan.getTermMonths()) {
                principal = balance;
                rowPayment = principal.add(interest, Amounts.MC);
            } else {
                rowPayment = payment;
                principal = payment.subtract(interest, Amounts.MC);
            }
            balance = balance.subtract(principal, Amounts.MC);
            cumulativeInterest = cumulativeInterest.add(interest, Amounts.MC);
            cumulativePrincipal = cumulativePrincipal.add(principal, Amounts.MC);

            return AmortizationRow.builder()
                    .month(month)
                    .payment(rowPayment)
                    .principal(principal)
                    .interest(interest)
                    .remainingBalance(balance)
                    .cumulativeInterest(cumulativeInterest)
                    .cumulativePrincipal(cumulativePrincipal)
                    .build();
        }
    }
}
