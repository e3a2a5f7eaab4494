package com.reitracker.kpi;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Ledger category rules for operating KPIs, prefix {@code rei.kpi.*}.
 *
 * <p>Income in a non-operating income category and expenses in a non-operating expense
 * category are left out of NOI. Expenses in the mortgage category are debt service and
 * tracked on their own. The gap thresholds decide whether a window's ledger is complete.
 */
@Data
@Component
@ConfigurationProperties(prefix = "rei.kpi")
public class KpiCategoryConfig {

    private Set<String> nonOperatingIncomeCategories = new LinkedHashSet<>(
            List.of("Security Deposit", "Loan Repayment", "Insurance Refund", "Escrow Refund"));

    private Set<String> nonOperatingExpenseCategories = new LinkedHashSet<>(List.of(
            "Asset Acquisition",
            "Capital Expenditures",
            "Bank/Financial Fees",
            "Legal/Professional Fees",
            "Marketing/Advertising",
            "Mortgage"));

    private String mortgageCategory = "Mortgage";

    /** Earliest record may fall at most this many days after the window start. */
    private int maxStartGapDays = 30;

    /** Latest record may fall at most this many days before today. */
    private int maxEndGapDays = 45;
}
