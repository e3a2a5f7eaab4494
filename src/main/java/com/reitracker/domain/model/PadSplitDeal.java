package com.reitracker.domain.model;

import com.reitracker.domain.enums.AnalysisType;
import com.reitracker.domain.vo.Amounts;
import com.reitracker.exception.FieldValidationException;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Co-living rental: rooms let individually through the PadSplit platform, which takes a cut of income. */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class PadSplitDeal extends DealSpec {

    private final Integer roomCount;
    private final BigDecimal averageRoomRent;
    private final BigDecimal padsplitPlatformPercentage;

    @Builder(toBuilder = true)
    private PadSplitDeal(
            @Builder.ObtainVia(method = "getProfile") DealProfile profile,
            Integer roomCount,
            BigDecimal averageRoomRent,
            BigDecimal padsplitPlatformPercentage) {
        super(profile);
        if (roomCount == null) {
            throw FieldValidationException.required("room_count");
        }
        if (roomCount < 0) {
            throw new FieldValidationException("room_count", "must not be negative");
        }
        if (averageRoomRent == null) {
            throw FieldValidationException.required("average_room_rent");
        }
        Amounts.requireNonNegative(averageRoomRent, "average_room_rent");
        if (padsplitPlatformPercentage == null) {
            throw FieldValidationException.required("padsplit_platform_percentage");
        }
        Amounts.requirePercentage(padsplitPlatformPercentage, "padsplit_platform_percentage");

        this.roomCount = roomCount;
        this.averageRoomRent = averageRoomRent;
        this.padsplitPlatformPercentage = padsplitPlatformPercentage;
    }

    @Override
    public AnalysisType getAnalysisType() {
        return AnalysisType.PAD_SPLIT;
    }

    @Override
    protected DealSpec withProfile(DealProfile profile) {
        return toBuilder().profile(profile).build();
    }
}
