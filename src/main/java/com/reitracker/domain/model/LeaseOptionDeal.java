package com.reitracker.domain.model;

import com.reitracker.domain.enums.AnalysisType;
import com.reitracker.domain.vo.Amounts;
import com.reitracker.exception.FieldValidationException;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Lease with an option to purchase at a fixed strike price.
 *
 * <p>The tenant-buyer pays an upfront option consideration fee and, each month, a share of
 * the rent is credited toward the strike price. A null {@code rentCreditCap} means the
 * credits are uncapped.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class LeaseOptionDeal extends DealSpec {

    private final BigDecimal optionConsiderationFee;
    private final Integer optionTermMonths;
    private final BigDecimal strikePrice;
    private final BigDecimal monthlyRentCreditPercentage;
    private final BigDecimal rentCreditCap;

    @Builder(toBuilder = true)
    private LeaseOptionDeal(
            @Builder.ObtainVia(method = "getProfile") DealProfile profile,
            BigDecimal optionConsiderationFee,
            Integer optionTermMonths,
            BigDecimal strikePrice,
            BigDecimal monthlyRentCreditPercentage,
            BigDecimal rentCreditCap) {
        super(profile);
        if (optionConsiderationFee == null) {
            throw FieldValidationException.required("option_consideration_fee");
        }
        Amounts.requireNonNegative(optionConsiderationFee, "option_consideration_fee");
        if (optionTermMonths == null) {
            throw FieldValidationException.required("option_term_months");
        }
        if (optionTermMonths <= 0) {
            throw new FieldValidationException("option_term_months", "must be positive");
        }
        if (strikePrice == null) {
            throw FieldValidationException.required("strike_price");
        }
        if (profile.getMonthlyRent() == null) {
            throw FieldValidationException.required("monthly_rent");
        }
        if (strikePrice.compareTo(profile.getPurchasePrice()) <= 0) {
            throw new FieldValidationException("strike_price", "must be greater than purchase price");
        }
        Amounts.requirePercentage(monthlyRentCreditPercentage, "monthly_rent_credit_percentage");
        Amounts.requireNonNegative(rentCreditCap, "rent_credit_cap");

        this.optionConsiderationFee = optionConsiderationFee;
        this.optionTermMonths = optionTermMonths;
        this.strikePrice = strikePrice;
        this.monthlyRentCreditPercentage = monthlyRentCreditPercentage;
        this.rentCreditCap = rentCreditCap;
    }

    @Override
    public AnalysisType getAnalysisType() {
        return AnalysisType.LEASE_OPTION;
    }

    @Override
    protected DealSpec withProfile(DealProfile profile) {
        return toBuilder().profile(profile).build();
    }
}
