package com.reitracker.unit.kpi;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.reitracker.domain.enums.ConfidenceLevel;
import com.reitracker.domain.enums.TransactionType;
import com.reitracker.domain.model.KpiDashboard;
import com.reitracker.domain.model.KpiResult;
import com.reitracker.domain.model.PropertyFacts;
import com.reitracker.domain.model.RefinanceInfo;
import com.reitracker.domain.model.TransactionRecord;
import com.reitracker.kpi.KpiCategoryConfig;
import com.reitracker.kpi.PropertyKpiService;
import com.reitracker.kpi.PropertyKpiServiceFactory;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PropertyKpiService.
 *
 * <p>Today is fixed at 2024-06-15. The reference ledger has three months (March to May 2024)
 * of 2,000 rent, 500 repairs and an 800 mortgage payment for a 200,000 property bought on
 * 2024-02-15 with 50,000 cash invested.
 */
class PropertyKpiServiceTest {

    private static final String PROPERTY = "12 Oak Lane";
    private static final LocalDate TODAY = LocalDate.of(2024, 6, 15);

    private PropertyKpiServiceFactory factory;
    private PropertyKpiService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);
        factory = new PropertyKpiServiceFactory(new KpiCategoryConfig(), clock);
        service = factory.forProperties(List.of(property(new BigDecimal("200000"), LocalDate.of(2024, 2, 15))));
    }

    private static PropertyFacts property(BigDecimal purchasePrice, LocalDate purchaseDate) {
        return PropertyFacts.builder()
                .propertyId(PROPERTY)
                .purchaseDate(purchaseDate)
                .purchasePrice(purchasePrice)
                .downPayment(new BigDecimal("40000"))
                .closingCosts(new BigDecimal("5000"))
                .renovationCosts(new BigDecimal("5000"))
                .build();
    }

    private static TransactionRecord record(LocalDate date, TransactionType type, String category, String amount) {
        return TransactionRecord.builder()
                .id(date + "-" + category)
                .propertyId(PROPERTY)
                .date(date)
                .type(type)
                .category(category)
                .amount(new BigDecimal(amount))
                .build();
    }

    private static List<TransactionRecord> referenceLedger() {
        List<TransactionRecord> ledger = new ArrayList<>();
        for (int month = 3; month <= 5; month++) {
            LocalDate date = LocalDate.of(2024, month, 10);
            ledger.add(record(date, TransactionType.INCOME, "Rent", "2000"));
            ledger.add(record(date, TransactionType.EXPENSE, "Repairs", "500"));
            ledger.add(record(date, TransactionType.EXPENSE, "Mortgage", "800"));
        }
        return ledger;
    }

    // ==============================
    // AVERAGES AND RATIOS
    // ==============================

    @Nested
    @DisplayName("Monthly averages")
    class MonthlyAverages {

        @Test
        @DisplayName("Three months of 2,000 income and 500 expense give NOI 1,500 and a 9% cap rate")
        void referenceLedger_noiAndCapRate() {
            KpiResult result = service.yearToDate(PROPERTY, referenceLedger());

            assertThat(result.getNetOperatingIncome().getMonthly()).isCloseTo(1500.0, within(0.001));
            assertThat(result.getNetOperatingIncome().getAnnual()).isCloseTo(18000.0, within(0.001));
            assertThat(result.getTotalIncome().getMonthly()).isCloseTo(2000.0, within(0.001));
            assertThat(result.getTotalExpenses().getMonthly()).isCloseTo(500.0, within(0.001));
            assertThat(result.getCapRate()).isCloseTo(9.0, within(0.001));
        }

        @Test
        @DisplayName("Mortgage is debt service: DSCR and cash-on-cash use it")
        void mortgage_debtService() {
            KpiResult result = service.yearToDate(PROPERTY, referenceLedger());

            // 1500 / 800
            assertThat(result.getDebtServiceCoverageRatio()).isCloseTo(1.875, within(0.001));
            // (1500 - 800) * 12 / 50,000
            assertThat(result.getCashOnCashReturn()).isCloseTo(16.8, within(0.001));
            assertThat(result.getCashInvested()).isCloseTo(50000.0, within(0.001));
        }

        @Test
        @DisplayName("A month holding only excluded categories does not dilute the averages")
        void excludedOnlyMonth_notCounted() {
            List<TransactionRecord> ledger = referenceLedger();
            ledger.add(record(LocalDate.of(2024, 6, 1), TransactionType.INCOME, "Security Deposit", "2000"));
            ledger.add(record(LocalDate.of(2024, 6, 2), TransactionType.EXPENSE, "Capital Expenditures", "9000"));

            KpiResult result = service.yearToDate(PROPERTY, ledger);

            // still 6,000 income over the three months that contributed an amount
            assertThat(result.getTotalIncome().getMonthly()).isCloseTo(2000.0, within(0.001));
            assertThat(result.getTotalExpenses().getMonthly()).isCloseTo(500.0, within(0.001));
            assertThat(result.getNetOperatingIncome().getMonthly()).isCloseTo(1500.0, within(0.001));
            assertThat(result.getCapRate()).isCloseTo(9.0, within(0.001));
        }

        @Test
        @DisplayName("A window of only excluded records averages to zero")
        void onlyExcludedRecords_zeroAverages() {
            List<TransactionRecord> ledger = List.of(
                    record(LocalDate.of(2024, 6, 1), TransactionType.INCOME, "Security Deposit", "2000"));

            KpiResult result = service.yearToDate(PROPERTY, ledger);

            assertThat(result.getTotalIncome().getMonthly()).isZero();
            assertThat(result.getNetOperatingIncome().getMonthly()).isZero();
            assertThat(result.getDebtServiceCoverageRatio()).isNull();
        }

        @Test
        @DisplayName("A record without a category counts as operating")
        void nullCategory_countsAsOperating() {
            List<TransactionRecord> ledger = referenceLedger();
            ledger.add(record(LocalDate.of(2024, 5, 20), TransactionType.INCOME, null, "300"));
            ledger.add(record(LocalDate.of(2024, 5, 21), TransactionType.EXPENSE, null, "150"));

            KpiResult result = service.yearToDate(PROPERTY, ledger);

            // (6,000 + 300) / 3 and (1,500 + 150) / 3
            assertThat(result.getTotalIncome().getMonthly()).isCloseTo(2100.0, within(0.001));
            assertThat(result.getTotalExpenses().getMonthly()).isCloseTo(550.0, within(0.001));
        }

        @Test
        @DisplayName("A null property id yields the empty result")
        void nullPropertyId_empty() {
            assertThat(service.yearToDate(null, referenceLedger()).getNetOperatingIncome().getMonthly()).isZero();
            assertThat(service.sinceAcquisition(null, referenceLedger()).getMetadata().isHasCompleteHistory()).isFalse();
        }

        @Test
        @DisplayName("No mortgage means no DSCR")
        void noMortgage_dscrNull() {
            List<TransactionRecord> ledger = referenceLedger().stream()
                    .filter(t -> !"Mortgage".equals(t.getCategory()))
                    .toList();

            KpiResult result = service.yearToDate(PROPERTY, ledger);

            assertThat(result.getDebtServiceCoverageRatio()).isNull();
            assertThat(result.getMetadata().getRefinanceInfo().isHasRefinanced()).isFalse();
        }

        @Test
        @DisplayName("Zero purchase price means no cap rate")
        void zeroPrice_capRateNull() {
            PropertyKpiService zeroPrice = factory.forProperties(List.of(property(BigDecimal.ZERO, null)));

            KpiResult result = zeroPrice.yearToDate(PROPERTY, referenceLedger());

            assertThat(result.getCapRate()).isNull();
            assertThat(result.getNetOperatingIncome().getMonthly()).isCloseTo(1500.0, within(0.001));
        }

        @Test
        @DisplayName("Other properties' records and records outside the window are ignored")
        void filtering() {
            List<TransactionRecord> ledger = referenceLedger();
            ledger.add(record(LocalDate.of(2023, 12, 31), TransactionType.INCOME, "Rent", "99999"));
            ledger.add(TransactionRecord.builder()
                    .propertyId("other")
                    .date(LocalDate.of(2024, 3, 5))
                    .type(TransactionType.INCOME)
                    .category("Rent")
                    .amount(new BigDecimal("99999"))
                    .build());

            KpiResult result = service.yearToDate(PROPERTY, ledger);

            assertThat(result.getTotalIncome().getMonthly()).isCloseTo(2000.0, within(0.001));
        }

        @Test
        @DisplayName("Window bounds are inclusive")
        void inclusiveBounds() {
            List<TransactionRecord> ledger = List.of(record(TODAY, TransactionType.INCOME, "Rent", "1200"));

            KpiResult result = service.calculate(PROPERTY, ledger, TODAY, TODAY);

            assertThat(result.getTotalIncome().getMonthly()).isCloseTo(1200.0, within(0.001));
        }
    }

    // ==============================
    // EMPTY WINDOWS
    // ==============================

    @Nested
    @DisplayName("Empty windows")
    class EmptyWindows {

        @Test
        @DisplayName("Empty ledger gives a zero-valued, incomplete result")
        void emptyLedger() {
            KpiResult result = service.yearToDate(PROPERTY, List.of());

            assertThat(result.getNetOperatingIncome().getMonthly()).isZero();
            assertThat(result.getCapRate()).isZero();
            assertThat(result.getMetadata().isHasCompleteHistory()).isFalse();
            assertThat(result.getMetadata().getConfidenceLevel()).isEqualTo(ConfidenceLevel.LOW);
        }

        @Test
        @DisplayName("Unknown property gives the empty result")
        void unknownProperty() {
            assertThat(service.yearToDate("nowhere", referenceLedger())).isEqualTo(KpiResult.empty());
        }

        @Test
        @DisplayName("Missing purchase date gives an empty since-acquisition result")
        void missingPurchaseDate() {
            PropertyKpiService noDate = factory.forProperties(List.of(property(new BigDecimal("200000"), null)));

            assertThat(noDate.sinceAcquisition(PROPERTY, referenceLedger())).isEqualTo(KpiResult.empty());
        }

        @Test
        @DisplayName("Duplicate property ids are rejected when the service is built")
        void duplicateIds_rejected() {
            PropertyFacts facts = property(BigDecimal.ONE, null);

            assertThatThrownBy(() -> factory.forProperties(List.of(facts, facts)))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    // ==============================
    // METADATA
    // ==============================

    @Nested
    @DisplayName("History and refinance metadata")
    class Metadata {

        @Test
        @DisplayName("Year to date is incomplete when the first record is two months after January 1")
        void ytd_incomplete() {
            KpiResult result = service.yearToDate(PROPERTY, referenceLedger());

            assertThat(result.getMetadata().isHasCompleteHistory()).isFalse();
            assertThat(result.getMetadata().getConfidenceLevel()).isEqualTo(ConfidenceLevel.LOW);
        }

        @Test
        @DisplayName("Since acquisition is complete when records start within 30 days of purchase")
        void sinceAcquisition_complete() {
            KpiResult result = service.sinceAcquisition(PROPERTY, referenceLedger());

            assertThat(result.getMetadata().isHasCompleteHistory()).isTrue();
            assertThat(result.getMetadata().getConfidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
        }

        @Test
        @DisplayName("A stale ledger is incomplete")
        void staleLedger_incomplete() {
            List<TransactionRecord> ledger = List.of(record(LocalDate.of(2024, 2, 20), TransactionType.INCOME, "Rent", "2000"));

            assertThat(service.sinceAcquisition(PROPERTY, ledger).getMetadata().isHasCompleteHistory()).isFalse();
        }

        @Test
        @DisplayName("A changed mortgage amount is reported as a refinance")
        void refinance_detected() {
            List<TransactionRecord> ledger = new ArrayList<>(referenceLedger());
            ledger.add(record(LocalDate.of(2024, 6, 5), TransactionType.EXPENSE, "Mortgage", "750"));

            RefinanceInfo info = service.yearToDate(PROPERTY, ledger).getMetadata().getRefinanceInfo();

            assertThat(info.isHasRefinanced()).isTrue();
            assertThat(info.getOriginalDebtService()).isEqualTo(800.0);
            assertThat(info.getCurrentDebtService()).isEqualTo(750.0);
        }

        @Test
        @DisplayName("Amounts equal in value but not in scale are not a refinance")
        void refinance_comparedByValue() {
            List<TransactionRecord> ledger = new ArrayList<>(referenceLedger());
            ledger.add(record(LocalDate.of(2024, 6, 5), TransactionType.EXPENSE, "Mortgage", "800.00"));

            RefinanceInfo info = service.yearToDate(PROPERTY, ledger).getMetadata().getRefinanceInfo();

            assertThat(info.isHasRefinanced()).isFalse();
            assertThat(info.getCurrentDebtService()).isEqualTo(800.0);
        }
    }

    // ==============================
    // DASHBOARD
    // ==============================

    @Test
    @DisplayName("Dashboard combines both windows and reports since-acquisition completeness")
    void dashboard() {
        KpiDashboard dashboard = service.kpiDashboard(PROPERTY, referenceLedger());

        assertThat(dashboard.getYearToDate().getCapRate()).isCloseTo(9.0, within(0.001));
        assertThat(dashboard.getSinceAcquisition().getCapRate()).isCloseTo(9.0, within(0.001));
        assertThat(dashboard.getMetadata().getPropertyId()).isEqualTo(PROPERTY);
        assertThat(dashboard.getMetadata().isHasCompleteHistory()).isTrue();
    }
}
