package com.reitracker.analysis;

import com.reitracker.domain.model.AnalysisReport;
import com.reitracker.domain.model.BrrrrDeal;
import com.reitracker.domain.model.DealProfile;
import com.reitracker.domain.model.DealSpec;
import com.reitracker.domain.model.LeaseOptionDeal;
import com.reitracker.domain.model.MultiFamilyDeal;
import com.reitracker.domain.model.PadSplitDeal;
import com.reitracker.domain.vo.Amounts;
import com.reitracker.domain.vo.LoanSpec;
import com.reitracker.domain.vo.UnitType;
import com.reitracker.loan.LoanPaymentCalculator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Derives cash flow, return and ratio metrics from a {@link DealSpec}.
 *
 * <p>Every method is a pure function of the deal: the engine holds no state and never
 * modifies its input. Strategy-specific behaviour is selected by the deal's variant:
 * <ul>
 *   <li><b>Income:</b> monthly rent, the multifamily unit mix plus other income, or
 *       PadSplit rooms x average room rent</li>
 *   <li><b>Expenses:</b> fixed monthly lines plus percentage-of-income reserves; PadSplit
 *       adds the platform fee and multifamily adds its building-level lines</li>
 *   <li><b>Financing:</b> the refinance loan only counts for BRRRR, the balloon refinance
 *       loan only when the deal has a balloon payment</li>
 * </ul>
 *
 * <p>Degenerate denominators never throw. Ratios with a zero denominator return 0 where the
 * result is a plain number and {@link Optional#empty()} where it is optional.
 */
@Service
public class AnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngine.class);

    private final LoanPaymentCalculator loanPaymentCalculator;

    public AnalysisEngine(LoanPaymentCalculator loanPaymentCalculator) {
        this.loanPaymentCalculator = loanPaymentCalculator;
    }

    // ========================
    // CASH FLOW
    // ========================

    public BigDecimal monthlyIncome(DealSpec deal) {
        if (deal instanceof MultiFamilyDeal multiFamily) {
            BigDecimal unitRent = multiFamily.getUnitTypes().stream()
                    .map(UnitType::getPotentialRent)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            return unitRent.add(Amounts.orZero(multiFamily.getOtherIncome()));
        }
        if (deal instanceof PadSplitDeal padSplit) {
            return padSplit.getAverageRoomRent().multiply(BigDecimal.valueOf(padSplit.getRoomCount()));
        }
        return Amounts.orZero(deal.getProfile().getMonthlyRent());
    }

    public BigDecimal monthlyOperatingExpenses(DealSpec deal) {
        DealProfile profile = deal.getProfile();
        BigDecimal income = monthlyIncome(deal);

        BigDecimal fixed = Amounts.monthly(profile.getPropertyTaxes())
                .add(Amounts.monthly(profile.getInsurance()))
                .add(Amounts.orZero(profile.getHoaCoaCoop()))
                .add(Amounts.orZero(profile.getUtilities()))
                .add(Amounts.orZero(profile.getInternet()))
                .add(Amounts.orZero(profile.getCleaning()))
                .add(Amounts.orZero(profile.getPestControl()))
                .add(Amounts.orZero(profile.getLandscaping()));

        BigDecimal reserves = Amounts.percentOf(income, profile.getManagementFeePercentage())
                .add(Amounts.percentOf(income, profile.getCapexPercentage()))
                .add(Amounts.percentOf(income, profile.getVacancyPercentage()))
                .add(Amounts.percentOf(income, profile.getRepairsPercentage()));

        BigDecimal expenses = fixed.add(reserves);

        if (deal instanceof PadSplitDeal padSplit) {
            expenses = expenses.add(Amounts.percentOf(income, padSplit.getPadsplitPlatformPercentage()));
        } else if (deal instanceof MultiFamilyDeal multiFamily) {
            expenses = expenses.add(Amounts.orZero(multiFamily.getCommonAreaMaintenance()))
                    .add(Amounts.orZero(multiFamily.getElevatorMaintenance()))
                    .add(Amounts.orZero(multiFamily.getStaffPayroll()))
                    .add(Amounts.orZero(multiFamily.getTrashRemoval()))
                    .add(Amounts.orZero(multiFamily.getCommonUtilities()));
        }

        log.debug("Deal {} operating expenses: fixed={}, reserves={}, total={}", deal.getId(), fixed, reserves, expenses);
        return expenses;
    }

    /** Loans whose payments and closing cash count toward this deal, in financing order. */
    public List<LoanSpec> applicableLoans(DealSpec deal) {
        DealProfile profile = deal.getProfile();
        List<LoanSpec> loans = new ArrayList<>();
        addIfPresent(loans, profile.getInitialLoan());
        if (deal instanceof BrrrrDeal brrrr) {
            addIfPresent(loans, brrrr.getRefinanceLoan());
        }
        addIfPresent(loans, profile.getLoan1());
        addIfPresent(loans, profile.getLoan2());
        addIfPresent(loans, profile.getLoan3());
        if (profile.isHasBalloonPayment()) {
            addIfPresent(loans, profile.getBalloonRefinanceLoan());
        }
        return loans;
    }

    public BigDecimal monthlyDebtService(DealSpec deal) {
        return applicableLoans(deal).stream()
                .map(loanPaymentCalculator::monthlyPayment)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal monthlyCashFlow(DealSpec deal) {
        BigDecimal income = monthlyIncome(deal);
        BigDecimal expenses = monthlyOperatingExpenses(deal);
        BigDecimal debtService = monthlyDebtService(deal);
        BigDecimal cashFlow = income.subtract(expenses).subtract(debtService);
        log.debug(
                "Deal {} cash flow: income={} - expenses={} - debtService={} = {}",
                deal.getId(), income, expenses, debtService, cashFlow);
        return cashFlow;
    }

    /** Net operating income: income less operating expenses, before debt service. */
    public BigDecimal monthlyNetOperatingIncome(DealSpec deal) {
        return monthlyIncome(deal).subtract(monthlyOperatingExpenses(deal));
    }

    // ========================
    // INVESTMENT AND RETURNS
    // ========================

    /**
     * Cash the investor brings: loan down payments and closing costs plus deal-level acquisition
     * costs. For BRRRR the refinance loan is not an outlay; its cash-out, when positive, is taken
     * back out of the investment.
     */
    public BigDecimal totalInvestment(DealSpec deal) {
        DealProfile profile = deal.getProfile();
        LoanSpec refinanceLoan = deal instanceof BrrrrDeal brrrr ? brrrr.getRefinanceLoan() : null;
        BigDecimal total = applicableLoans(deal).stream()
                .filter(loan -> loan != refinanceLoan)
                .map(LoanSpec::getInitialCosts)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        total = total.add(Amounts.orZero(profile.getClosingCosts()))
                .add(Amounts.orZero(profile.getRenovationCosts()))
                .add(Amounts.orZero(profile.getFurnishingCosts()))
                .add(Amounts.orZero(profile.getMarketingCosts()))
                .add(Amounts.orZero(profile.getCashToSeller()))
                .add(Amounts.orZero(profile.getAssignmentFee()));

        if (deal instanceof LeaseOptionDeal leaseOption) {
            total = total.add(leaseOption.getOptionConsiderationFee());
        }
        BigDecimal cashOut = cashRecouped(deal).orElse(BigDecimal.ZERO);
        if (cashOut.signum() > 0) {
            total = total.subtract(cashOut);
        }
        return total;
    }

    /** Annual cash flow over total investment, in percent. Zero when nothing is invested. */
    public BigDecimal cashOnCashReturn(DealSpec deal) {
        BigDecimal investment = totalInvestment(deal);
        if (investment.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal annualCashFlow = monthlyCashFlow(deal).multiply(Amounts.TWELVE);
        return annualCashFlow.divide(investment, Amounts.MC).multiply(Amounts.HUNDRED);
    }

    /** Annual NOI over purchase price, in percent. Zero for a zero purchase price. */
    public BigDecimal capRate(DealSpec deal) {
        BigDecimal purchasePrice = deal.getProfile().getPurchasePrice();
        if (purchasePrice.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal annualNoi = monthlyCashFlow(deal).add(monthlyDebtService(deal)).multiply(Amounts.TWELVE);
        return annualNoi.divide(purchasePrice, Amounts.MC).multiply(Amounts.HUNDRED);
    }

    /** NOI over debt service. Empty when the deal carries no debt. */
    public Optional<BigDecimal> debtServiceCoverageRatio(DealSpec deal) {
        BigDecimal debtService = monthlyDebtService(deal);
        if (debtService.signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(monthlyNetOperatingIncome(deal).divide(debtService, Amounts.MC));
    }

    /** Operating expenses as a percent of income. Zero when there is no income. */
    public BigDecimal operatingExpenseRatio(DealSpec deal) {
        BigDecimal income = monthlyIncome(deal);
        if (income.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return monthlyOperatingExpenses(deal).divide(income, Amounts.MC).multiply(Amounts.HUNDRED);
    }

    /** Purchase price over annual gross income. Zero when there is no income. */
    public BigDecimal grossRentMultiplier(DealSpec deal) {
        BigDecimal annualIncome = monthlyIncome(deal).multiply(Amounts.TWELVE);
        if (annualIncome.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return deal.getProfile().getPurchasePrice().divide(annualIncome, Amounts.MC);
    }

    /**
     * Occupancy, in percent, at which income covers operating expenses and debt service.
     * Capped at 100; a deal with no income needs 100.
     */
    public BigDecimal breakevenOccupancy(DealSpec deal) {
        BigDecimal income = monthlyIncome(deal);
        if (income.signum() == 0) {
            return Amounts.HUNDRED;
        }
        BigDecimal breakeven = monthlyOperatingExpenses(deal)
                .add(monthlyDebtService(deal))
                .divide(income, Amounts.MC)
                .multiply(Amounts.HUNDRED);
        return breakeven.min(Amounts.HUNDRED);
    }

    // ========================
    // MULTIFAMILY
    // ========================

    public Optional<BigDecimal> pricePerUnit(DealSpec deal) {
        if (deal instanceof MultiFamilyDeal multiFamily && multiFamily.getTotalUnits() > 0) {
            return Optional.of(deal.getProfile()
                    .getPurchasePrice()
                    .divide(BigDecimal.valueOf(multiFamily.getTotalUnits()), Amounts.MC));
        }
        return Optional.empty();
    }

    public Optional<BigDecimal> occupancyRate(DealSpec deal) {
        if (deal instanceof MultiFamilyDeal multiFamily && multiFamily.getTotalUnits() > 0) {
            return Optional.of(BigDecimal.valueOf(multiFamily.getOccupiedUnits())
                    .divide(BigDecimal.valueOf(multiFamily.getTotalUnits()), Amounts.MC)
                    .multiply(Amounts.HUNDRED));
        }
        return Optional.empty();
    }

    // ========================
    // LEASE OPTION
    // ========================

    /** Rent credited toward the strike price over the whole option term, limited by the cap if one is set. */
    public Optional<BigDecimal> totalRentCredits(DealSpec deal) {
        if (!(deal instanceof LeaseOptionDeal leaseOption)) {
            return Optional.empty();
        }
        BigDecimal monthlyCredit = Amounts.percentOf(
                Amounts.orZero(deal.getProfile().getMonthlyRent()), leaseOption.getMonthlyRentCreditPercentage());
        BigDecimal credits = monthlyCredit.multiply(BigDecimal.valueOf(leaseOption.getOptionTermMonths()));
        if (leaseOption.getRentCreditCap() != null) {
            credits = credits.min(leaseOption.getRentCreditCap());
        }
        return Optional.of(credits);
    }

    /** Strike price less the option fee and rent credits, floored at zero. */
    public Optional<BigDecimal> effectivePurchasePrice(DealSpec deal) {
        if (!(deal instanceof LeaseOptionDeal leaseOption)) {
            return Optional.empty();
        }
        BigDecimal effective = leaseOption.getStrikePrice()
                .subtract(leaseOption.getOptionConsiderationFee())
                .subtract(totalRentCredits(deal).orElse(BigDecimal.ZERO));
        return Optional.of(effective.max(BigDecimal.ZERO));
    }

    /** Annual cash flow over the option fee, in percent. Empty for a zero fee. */
    public Optional<BigDecimal> optionFeeRoi(DealSpec deal) {
        if (!(deal instanceof LeaseOptionDeal leaseOption)
                || leaseOption.getOptionConsiderationFee().signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(monthlyCashFlow(deal)
                .multiply(Amounts.TWELVE)
                .divide(leaseOption.getOptionConsiderationFee(), Amounts.MC)
                .multiply(Amounts.HUNDRED));
    }

    /** Whole months of cash flow needed to recover the total investment. Empty unless cash flow is positive. */
    public Optional<Integer> breakevenMonths(DealSpec deal) {
        if (!(deal instanceof LeaseOptionDeal)) {
            return Optional.empty();
        }
        BigDecimal cashFlow = monthlyCashFlow(deal);
        if (cashFlow.signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(totalInvestment(deal).divide(cashFlow, 0, RoundingMode.CEILING).intValue());
    }

    // ========================
    // HOLDING AND BRRRR
    // ========================

    /**
     * Monthly carry while the property is being renovated: taxes, insurance, utilities, HOA
     * and interest-only carry on the acquisition loan (the initial loan for BRRRR, loan 1
     * for the other strategies).
     */
    public BigDecimal monthlyHoldingCosts(DealSpec deal) {
        DealProfile profile = deal.getProfile();
        BigDecimal holding = Amounts.monthly(profile.getPropertyTaxes())
                .add(Amounts.monthly(profile.getInsurance()))
                .add(Amounts.orZero(profile.getUtilities()))
                .add(Amounts.orZero(profile.getHoaCoaCoop()));
        LoanSpec acquisitionLoan = deal instanceof BrrrrDeal ? profile.getInitialLoan() : profile.getLoan1();
        if (acquisitionLoan != null) {
            holding = holding.add(loanPaymentCalculator.monthlyInterest(acquisitionLoan));
        }
        return holding;
    }

    /** Monthly holding costs over the renovation period; zero when no duration is set. */
    public BigDecimal holdingCosts(DealSpec deal) {
        return monthlyHoldingCosts(deal).multiply(Amounts.orZero(deal.getProfile().getRenovationDurationMonths()));
    }

    public Optional<BigDecimal> totalProjectCosts(DealSpec deal) {
        if (!(deal instanceof BrrrrDeal)) {
            return Optional.empty();
        }
        DealProfile profile = deal.getProfile();
        return Optional.of(profile.getPurchasePrice()
                .add(Amounts.orZero(profile.getRenovationCosts()))
                .add(Amounts.orZero(profile.getClosingCosts()))
                .add(holdingCosts(deal)));
    }

    /** After-repair value less everything spent to get there. */
    public Optional<BigDecimal> equityCaptured(DealSpec deal) {
        if (!(deal instanceof BrrrrDeal brrrr)) {
            return Optional.empty();
        }
        return totalProjectCosts(deal).map(costs -> brrrr.getAfterRepairValue().subtract(costs));
    }

    /** Refinance proceeds left after paying off the initial loan. Empty without a refinance loan. */
    public Optional<BigDecimal> cashRecouped(DealSpec deal) {
        if (!(deal instanceof BrrrrDeal brrrr) || brrrr.getRefinanceLoan() == null) {
            return Optional.empty();
        }
        LoanSpec initialLoan = deal.getProfile().getInitialLoan();
        BigDecimal payoff = initialLoan != null ? initialLoan.getPrincipal() : BigDecimal.ZERO;
        return Optional.of(brrrr.getRefinanceLoan().getPrincipal().subtract(payoff));
    }

    // ========================
    // REPORT
    // ========================

    /** Every metric for the deal, rounded to cents. */
    public AnalysisReport analyze(DealSpec deal) {
        BigDecimal monthlyCashFlow = monthlyCashFlow(deal);
        boolean brrrr = deal instanceof BrrrrDeal;

        AnalysisReport report = AnalysisReport.builder()
                .dealId(deal.getId())
                .analysisType(deal.getAnalysisType())
                .monthlyIncome(Amounts.cents(monthlyIncome(deal)))
                .monthlyOperatingExpenses(Amounts.cents(monthlyOperatingExpenses(deal)))
                .monthlyDebtService(Amounts.cents(monthlyDebtService(deal)))
                .monthlyCashFlow(Amounts.cents(monthlyCashFlow))
                .annualCashFlow(Amounts.cents(monthlyCashFlow.multiply(Amounts.TWELVE)))
                .totalInvestment(Amounts.cents(totalInvestment(deal)))
                .cashOnCashReturn(Amounts.cents(cashOnCashReturn(deal)))
                .capRate(Amounts.cents(capRate(deal)))
                .debtServiceCoverageRatio(rounded(debtServiceCoverageRatio(deal)))
                .operatingExpenseRatio(Amounts.cents(operatingExpenseRatio(deal)))
                .grossRentMultiplier(Amounts.cents(grossRentMultiplier(deal)))
                .breakevenOccupancy(Amounts.cents(breakevenOccupancy(deal)))
                .pricePerUnit(rounded(pricePerUnit(deal)))
                .occupancyRate(rounded(occupancyRate(deal)))
                .effectivePurchasePrice(rounded(effectivePurchasePrice(deal)))
                .totalRentCredits(rounded(totalRentCredits(deal)))
                .optionFeeRoi(rounded(optionFeeRoi(deal)))
                .breakevenMonths(breakevenMonths(deal).orElse(null))
                .holdingCosts(brrrr ? Amounts.cents(holdingCosts(deal)) : null)
                .totalProjectCosts(rounded(totalProjectCosts(deal)))
                .equityCaptured(rounded(equityCaptured(deal)))
                .cashRecouped(rounded(cashRecouped(deal)))
                .build();

        log.debug(
                "Analyzed {} deal {}: cashFlow={}, coc={}%, cap={}%",
                deal.getAnalysisType(), deal.getId(), report.getMonthlyCashFlow(),
                report.getCashOnCashReturn(), report.getCapRate());
        return report;
    }

    private static BigDecimal rounded(Optional<BigDecimal> value) {
        return value.map(Amounts::cents).orElse(null);
    }

    private static void addIfPresent(List<LoanSpec> loans, LoanSpec loan) {
        if (loan != null) {
            loans.add(loan);
        }
    }
}
