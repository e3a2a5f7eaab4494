package com.reitracker.domain.model;

import com.reitracker.domain.enums.AnalysisType;
import com.reitracker.exception.FieldValidationException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/** Buy-and-hold rental. Income is the profile's monthly rent. */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class LongTermRentalDeal extends DealSpec {

    @Builder(toBuilder = true)
    private LongTermRentalDeal(@Builder.ObtainVia(method = "getProfile") DealProfile profile) {
        super(profile);
        if (profile.getMonthlyRent() == null) {
            throw FieldValidationException.required("monthly_rent");
        }
    }

    @Override
    public AnalysisType getAnalysisType() {
        return AnalysisType.LTR;
    }

    @Override
    protected DealSpec withProfile(DealProfile profile) {
        return toBuilder().profile(profile).build();
    }
}
