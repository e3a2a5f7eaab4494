package com.reitracker.kpi;

import com.reitracker.domain.enums.ConfidenceLevel;
import com.reitracker.domain.enums.TransactionType;
import com.reitracker.domain.model.KpiDashboard;
import com.reitracker.domain.model.KpiMetadata;
import com.reitracker.domain.model.KpiResult;
import com.reitracker.domain.model.PeriodAmount;
import com.reitracker.domain.model.PropertyFacts;
import com.reitracker.domain.model.RefinanceInfo;
import com.reitracker.domain.model.TransactionRecord;
import com.reitracker.domain.vo.Amounts;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trailing operating KPIs of owned properties, computed from their transaction ledgers.
 *
 * <p>Two windows are reported per property: year to date (January 1 of the current year
 * through today) and since acquisition (purchase date through today). Within a window the
 * ledger is bucketed by calendar month and averaged over the months that contributed an
 * income, operating expense or mortgage amount, so neither empty months nor months holding
 * only excluded categories dilute the averages.
 *
 * <p>Instances are immutable and hold the property index they were built with; obtain them
 * from {@link PropertyKpiServiceFactory}. Unknown properties and empty windows produce
 * {@link KpiResult#empty()} rather than an error.
 */
public class PropertyKpiService {

    private static final Logger log = LoggerFactory.getLogger(PropertyKpiService.class);

    private final Map<String, PropertyFacts> propertiesById;
    private final Set<String> nonOperatingIncomeCategories;
    private final Set<String> nonOperatingExpenseCategories;
    private final String mortgageCategory;
    private final int maxStartGapDays;
    private final int maxEndGapDays;
    private final Clock clock;

    PropertyKpiService(Map<String, PropertyFacts> propertiesById, KpiCategoryConfig config, Clock clock) {
        // null-tolerant lookups: ledger categories and caller ids may be missing
        this.propertiesById = Collections.unmodifiableMap(new HashMap<>(propertiesById));
        this.nonOperatingIncomeCategories = Collections.unmodifiableSet(new HashSet<>(config.getNonOperatingIncomeCategories()));
        this.nonOperatingExpenseCategories = Collections.unmodifiableSet(new HashSet<>(config.getNonOperatingExpenseCategories()));
        this.mortgageCategory = config.getMortgageCategory();
        this.maxStartGapDays = config.getMaxStartGapDays();
        this.maxEndGapDays = config.getMaxEndGapDays();
        this.clock = clock;
    }

    /**
     * Year-to-date and since-acquisition KPIs for one property.
     *
     * @param propertyId the property to report on
     * @param ledger     transactions, possibly spanning other properties
     */
    public KpiDashboard kpiDashboard(String propertyId, List<TransactionRecord> ledger) {
        KpiResult yearToDate = yearToDate(propertyId, ledger);
        KpiResult sinceAcquisition = sinceAcquisition(propertyId, ledger);
        boolean complete = sinceAcquisition.getMetadata().isHasCompleteHistory();

        log.info(
                "KPI dashboard for property {}: ytdNoi={}, acquisitionNoi={}, completeHistory={}",
                propertyId,
                yearToDate.getNetOperatingIncome().getMonthly(),
                sinceAcquisition.getNetOperatingIncome().getMonthly(),
                complete);

        return KpiDashboard.builder()
                .yearToDate(yearToDate)
                .sinceAcquisition(sinceAcquisition)
                .metadata(new KpiDashboard.Metadata(complete, propertyId))
                .build();
    }

    public KpiResult yearToDate(String propertyId, List<TransactionRecord> ledger) {
        LocalDate today = LocalDate.now(clock);
        return calculate(propertyId, ledger, today.withDayOfYear(1), today);
    }

    public KpiResult sinceAcquisition(String propertyId, List<TransactionRecord> ledger) {
        PropertyFacts property = propertiesById.get(propertyId);
        if (property == null || property.getPurchaseDate() == null) {
            log.warn("Purchase date not found for property {}", propertyId);
            return KpiResult.empty();
        }
        return calculate(propertyId, ledger, property.getPurchaseDate(), LocalDate.now(clock));
    }

    /**
     * KPIs for one property over an inclusive date window.
     *
     * @return the window's KPIs, or {@link KpiResult#empty()} when the property is unknown
     *     or has no records in the window
     */
    public KpiResult calculate(String propertyId, List<TransactionRecord> ledger, LocalDate start, LocalDate end) {
        PropertyFacts property = propertiesById.get(propertyId);
        if (property == null) {
            log.warn("Property details not found for {}", propertyId);
            return KpiResult.empty();
        }

        List<TransactionRecord> window = ledger.stream()
                .filter(t -> propertyId.equals(t.getPropertyId()))
                .filter(t -> t.getDate() != null && !t.getDate().isBefore(start) && !t.getDate().isAfter(end))
                .toList();
        if (window.isEmpty()) {
            log.warn("No transactions found for property {} between {} and {}", propertyId, start, end);
            return KpiResult.empty();
        }

        MonthlyAverages averages = monthlyAverages(window);
        BigDecimal noi = averages.income().subtract(averages.operatingExpenses());
        BigDecimal cashFlow = noi.subtract(averages.mortgage());
        BigDecimal annualNoi = noi.multiply(Amounts.TWELVE);

        BigDecimal purchasePrice = Amounts.orZero(property.getPurchasePrice());
        BigDecimal totalInvestment = totalInvestment(property);

        BigDecimal dscr = averages.mortgage().signum() > 0 ? Amounts.divide(noi, averages.mortgage()) : null;
        BigDecimal capRate = purchasePrice.signum() != 0
                ? Amounts.divide(annualNoi, purchasePrice).multiply(Amounts.HUNDRED)
                : null;
        BigDecimal cashOnCash = totalInvestment.signum() != 0
                ? Amounts.divide(cashFlow.multiply(Amounts.TWELVE), totalInvestment).multiply(Amounts.HUNDRED)
                : null;

        boolean complete = hasCompleteHistory(window, start, LocalDate.now(clock));

        log.debug(
                "KPIs for property {} [{} .. {}]: months={}, income={}, opex={}, mortgage={}, noi={}",
                propertyId, start, end, averages.months(), averages.income(), averages.operatingExpenses(),
                averages.mortgage(), noi);

        return KpiResult.builder()
                .netOperatingIncome(period(noi))
                .totalIncome(period(averages.income()))
                .totalExpenses(period(averages.operatingExpenses()))
                .capRate(NumberSanitizer.sanitize(capRate))
                .cashOnCashReturn(NumberSanitizer.sanitize(cashOnCash))
                .debtServiceCoverageRatio(NumberSanitizer.sanitize(dscr))
                .cashInvested(NumberSanitizer.sanitize(totalInvestment))
                .metadata(KpiMetadata.builder()
                        .hasCompleteHistory(complete)
                        .confidenceLevel(complete ? ConfidenceLevel.HIGH : ConfidenceLevel.LOW)
                        .refinanceInfo(refinanceInfo(window))
                        .build())
                .build();
    }

    /**
     * A window is complete when its first record falls within {@code maxStartGapDays} of the
     * window start and its last record within {@code maxEndGapDays} of today.
     */
    boolean hasCompleteHistory(List<TransactionRecord> window, LocalDate windowStart, LocalDate today) {
        if (window.isEmpty()) {
            return false;
        }
        LocalDate earliest = window.stream().map(TransactionRecord::getDate).min(Comparator.naturalOrder()).get();
        LocalDate latest = window.stream().map(TransactionRecord::getDate).max(Comparator.naturalOrder()).get();
        boolean startCovered = ChronoUnit.DAYS.between(windowStart, earliest) <= maxStartGapDays;
        boolean endCovered = ChronoUnit.DAYS.between(latest, today) <= maxEndGapDays;
        return startCovered && endCovered;
    }

    private MonthlyAverages monthlyAverages(List<TransactionRecord> window) {
        Set<YearMonth> observedMonths = new HashSet<>();
        Map<YearMonth, BigDecimal> income = new HashMap<>();
        Map<YearMonth, BigDecimal> operatingExpenses = new HashMap<>();
        Map<YearMonth, BigDecimal> mortgage = new HashMap<>();

        for (TransactionRecord record : window) {
            YearMonth month = YearMonth.from(record.getDate());
            BigDecimal amount = Amounts.orZero(record.getAmount());
            String category = record.getCategory();

            if (record.getType() == TransactionType.INCOME) {
                if (!nonOperatingIncomeCategories.contains(category)) {
                    income.merge(month, amount, BigDecimal::add);
                    observedMonths.add(month);
                }
            } else if (mortgageCategory.equals(category)) {
                mortgage.merge(month, amount, BigDecimal::add);
                observedMonths.add(month);
            } else if (!nonOperatingExpenseCategories.contains(category)) {
                operatingExpenses.merge(month, amount, BigDecimal::add);
                observedMonths.add(month);
            }
        }

        if (observedMonths.isEmpty()) {
            return new MonthlyAverages(0, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
        }
        BigDecimal months = BigDecimal.valueOf(observedMonths.size());
        return new MonthlyAverages(
                observedMonths.size(),
                Amounts.divide(sum(income), months),
                Amounts.divide(sum(operatingExpenses), months),
                Amounts.divide(sum(mortgage), months));
    }

    private RefinanceInfo refinanceInfo(List<TransactionRecord> window) {
        List<BigDecimal> payments = window.stream()
                .filter(t -> t.getType() == TransactionType.EXPENSE && mortgageCategory.equals(t.getCategory()))
                .sorted(Comparator.comparing(TransactionRecord::getDate))
                .map(t -> Amounts.orZero(t.getAmount()))
                .toList();
        if (payments.isEmpty()) {
            return RefinanceInfo.none();
        }

        long distinctAmounts = payments.stream().map(BigDecimal::stripTrailingZeros).distinct().count();
        BigDecimal first = payments.get(0);
        BigDecimal last = payments.get(payments.size() - 1);
        boolean refinanced = distinctAmounts > 1;
        return RefinanceInfo.builder()
                .hasRefinanced(refinanced)
                .originalDebtService(NumberSanitizer.sanitize(first))
                .currentDebtService(NumberSanitizer.sanitize(refinanced ? last : first))
                .build();
    }

    private static BigDecimal totalInvestment(PropertyFacts property) {
        return Amounts.orZero(property.getDownPayment())
                .add(Amounts.orZero(property.getClosingCosts()))
                .add(Amounts.orZero(property.getRenovationCosts()))
                .add(Amounts.orZero(property.getMarketingCosts()))
                .add(Amounts.orZero(property.getHoldingCosts()));
    }

    private static PeriodAmount period(BigDecimal monthly) {
        return new PeriodAmount(
                NumberSanitizer.sanitize(monthly), NumberSanitizer.sanitize(monthly.multiply(Amounts.TWELVE)));
    }

    private static BigDecimal sum(Map<YearMonth, BigDecimal> byMonth) {
        return byMonth.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private record MonthlyAverages(
            int months, BigDecimal income, BigDecimal operatingExpenses, BigDecimal mortgage) {}
}
