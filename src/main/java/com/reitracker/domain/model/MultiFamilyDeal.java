package com.reitracker.domain.model;

import com.reitracker.domain.enums.AnalysisType;
import com.reitracker.domain.vo.Amounts;
import com.reitracker.domain.vo.UnitType;
import com.reitracker.exception.FieldValidationException;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Multi-unit residential building. Income comes from the unit mix plus other income
 * (laundry, parking, storage); the building-level expense lines are monthly.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class MultiFamilyDeal extends DealSpec {

    private final Integer totalUnits;
    private final Integer occupiedUnits;
    private final List<UnitType> unitTypes;
    private final BigDecimal otherIncome;
    private final BigDecimal commonAreaMaintenance;
    private final BigDecimal elevatorMaintenance;
    private final BigDecimal staffPayroll;
    private final BigDecimal trashRemoval;
    private final BigDecimal commonUtilities;

    @Builder(toBuilder = true)
    private MultiFamilyDeal(
            @Builder.ObtainVia(method = "getProfile") DealProfile profile,
            Integer totalUnits,
            Integer occupiedUnits,
            List<UnitType> unitTypes,
            BigDecimal otherIncome,
            BigDecimal commonAreaMaintenance,
            BigDecimal elevatorMaintenance,
            BigDecimal staffPayroll,
            BigDecimal trashRemoval,
            BigDecimal commonUtilities) {
        super(profile);
        if (totalUnits == null) {
            throw FieldValidationException.required("total_units");
        }
        if (totalUnits < 0) {
            throw new FieldValidationException("total_units", "must not be negative");
        }
        if (occupiedUnits == null) {
            throw FieldValidationException.required("occupied_units");
        }
        if (occupiedUnits < 0 || occupiedUnits > totalUnits) {
            throw new FieldValidationException("occupied_units", "must be between 0 and total_units");
        }
        if (unitTypes == null || unitTypes.isEmpty()) {
            throw FieldValidationException.required("unit_types");
        }
        for (UnitType unitType : unitTypes) {
            if (unitType == null) {
                throw new FieldValidationException("unit_types", "must not contain empty entries");
            }
            if (unitType.getCount() < 0 || unitType.getOccupied() < 0) {
                throw new FieldValidationException("unit_types", "unit counts must not be negative");
            }
        }
        Amounts.requireNonNegative(otherIncome, "other_income");

        this.totalUnits = totalUnits;
        this.occupiedUnits = occupiedUnits;
        this.unitTypes = List.copyOf(unitTypes);
        this.otherIncome = otherIncome;
        this.commonAreaMaintenance = commonAreaMaintenance;
        this.elevatorMaintenance = elevatorMaintenance;
        this.staffPayroll = staffPayroll;
        this.trashRemoval = trashRemoval;
        this.commonUtilities = commonUtilities;
    }

    @Override
    public AnalysisType getAnalysisType() {
        return AnalysisType.MULTI_FAMILY;
    }

    @Override
    protected DealSpec withProfile(DealProfile profile) {
        return toBuilder().profile(profile).build();
    }
}
