package com.reitracker.domain.model;

import com.reitracker.domain.enums.AnalysisType;
import com.reitracker.domain.vo.Amounts;
import com.reitracker.exception.FieldValidationException;
import java.time.LocalDateTime;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A validated deal under one investment strategy.
 *
 * <p>The hierarchy is closed: each permitted subclass corresponds to one {@link AnalysisType}
 * and checks its own required fields in its constructor, which every builder goes through.
 * Common checks (purchase price, expense percentages, balloon financing) run here. A deal
 * that fails any check is never constructed.
 *
 * <p>Instances are immutable. {@link #touch(LocalDateTime)} is the only way to move the
 * {@code updatedAt} timestamp and returns a copy; the repository calls it on save.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract sealed class DealSpec
        permits LongTermRentalDeal, BrrrrDeal, LeaseOptionDeal, MultiFamilyDeal, PadSplitDeal {

    private final DealProfile profile;

    protected DealSpec(DealProfile profile) {
        if (profile == null) {
            throw FieldValidationException.required("profile");
        }
        if (profile.getPurchasePrice() == null) {
            throw FieldValidationException.required("purchase_price");
        }
        Amounts.requireNonNegative(profile.getPurchasePrice(), "purchase_price");
        Amounts.requireNonNegative(profile.getMonthlyRent(), "monthly_rent");
        Amounts.requireNonNegative(profile.getRenovationCosts(), "renovation_costs");
        Amounts.requirePercentage(profile.getManagementFeePercentage(), "management_fee_percentage");
        Amounts.requirePercentage(profile.getCapexPercentage(), "capex_percentage");
        Amounts.requirePercentage(profile.getVacancyPercentage(), "vacancy_percentage");
        Amounts.requirePercentage(profile.getRepairsPercentage(), "repairs_percentage");
        if (profile.getRenovationDurationMonths() != null && profile.getRenovationDurationMonths() < 0) {
            throw new FieldValidationException("renovation_duration", "must not be negative");
        }
        if (profile.isHasBalloonPayment()) {
            if (profile.getBalloonRefinanceLoan() == null) {
                throw FieldValidationException.required("balloon_refinance_loan");
            }
            Amounts.requirePercentage(profile.getBalloonRefinanceLtvPercentage(), "balloon_refinance_ltv_percentage");
        }
        this.profile = profile;
    }

    public abstract AnalysisType getAnalysisType();

    /** Rebuilds this variant around a new profile, re-running all validation. */
    protected abstract DealSpec withProfile(DealProfile profile);

    public String getId() {
        return profile.getId();
    }

    /** Returns a copy carrying the given identifier. */
    public DealSpec withId(String id) {
        return withProfile(profile.toBuilder().id(id).build());
    }

    /** Returns a copy stamped with the given modification time, also setting the creation time if unset. */
    public DealSpec touch(LocalDateTime updatedAt) {
        DealProfile.DealProfileBuilder stamped = profile.toBuilder().updatedAt(updatedAt);
        if (profile.getCreatedAt() == null) {
            stamped.createdAt(updatedAt);
        }
        return withProfile(stamped.build());
    }
}
