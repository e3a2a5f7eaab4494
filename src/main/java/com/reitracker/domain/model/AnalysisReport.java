package com.reitracker.domain.model;

import com.reitracker.domain.enums.AnalysisType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Every derived metric of one deal, rounded to cents.
 *
 * <p>Strategy-specific fields are null for deals of other strategies, as are ratios whose
 * denominator is zero (debt service coverage, price per unit).
 */
@Value
@Builder
public class AnalysisReport {

    String dealId;
    AnalysisType analysisType;

    BigDecimal monthlyIncome;
    BigDecimal monthlyOperatingExpenses;
    BigDecimal monthlyDebtService;
    BigDecimal monthlyCashFlow;
    BigDecimal annualCashFlow;
    BigDecimal totalInvestment;
    BigDecimal cashOnCashReturn;
    BigDecimal capRate;
    BigDecimal debtServiceCoverageRatio;
    BigDecimal operatingExpenseRatio;
    BigDecimal grossRentMultiplier;
    BigDecimal breakevenOccupancy;

    // MultiFamily
    BigDecimal pricePerUnit;
    BigDecimal occupancyRate;

    // LeaseOption
    BigDecimal effectivePurchasePrice;
    BigDecimal totalRentCredits;
    BigDecimal optionFeeRoi;
    Integer breakevenMonths;

    // BRRRR
    BigDecimal holdingCosts;
    BigDecimal totalProjectCosts;
    BigDecimal equityCaptured;
    BigDecimal cashRecouped;
}
