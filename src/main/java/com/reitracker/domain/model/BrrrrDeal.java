package com.reitracker.domain.model;

import com.reitracker.domain.enums.AnalysisType;
import com.reitracker.domain.vo.Amounts;
import com.reitracker.domain.vo.LoanSpec;
import com.reitracker.exception.FieldValidationException;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Buy, Rehab, Rent, Refinance, Repeat.
 *
 * <p>The profile's initial loan funds the purchase and renovation; once the work is done the
 * property is refinanced against its after-repair value. Renovation cost and duration are
 * required because both drive the offer ceiling.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class BrrrrDeal extends DealSpec {

    private final BigDecimal afterRepairValue;
    private final LoanSpec refinanceLoan;
    private final BigDecimal refinanceLtvPercentage;

    @Builder(toBuilder = true)
    private BrrrrDeal(
            @Builder.ObtainVia(method = "getProfile") DealProfile profile,
            BigDecimal afterRepairValue,
            LoanSpec refinanceLoan,
            BigDecimal refinanceLtvPercentage) {
        super(profile);
        if (afterRepairValue == null) {
            throw FieldValidationException.required("after_repair_value");
        }
        Amounts.requireNonNegative(afterRepairValue, "after_repair_value");
        if (profile.getRenovationCosts() == null) {
            throw FieldValidationException.required("renovation_costs");
        }
        if (profile.getRenovationDurationMonths() == null) {
            throw FieldValidationException.required("renovation_duration");
        }
        Amounts.requirePercentage(refinanceLtvPercentage, "refinance_ltv_percentage");

        this.afterRepairValue = afterRepairValue;
        this.refinanceLoan = refinanceLoan;
        this.refinanceLtvPercentage = refinanceLtvPercentage;
    }

    @Override
    public AnalysisType getAnalysisType() {
        return AnalysisType.BRRRR;
    }

    @Override
    protected DealSpec withProfile(DealProfile profile) {
        return toBuilder().profile(profile).build();
    }
}
