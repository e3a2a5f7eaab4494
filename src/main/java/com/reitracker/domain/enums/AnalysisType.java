package com.reitracker.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.reitracker.exception.FieldValidationException;
import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Investment strategy a deal is analysed under. The tag is the value stored in analysis
 * records ("LTR", "BRRRR", "LeaseOption", "MultiFamily", "PadSplit").
 */
@Getter
@RequiredArgsConstructor
public enum AnalysisType {
    LTR("LTR"),
    BRRRR("BRRRR"),
    LEASE_OPTION("LeaseOption"),
    MULTI_FAMILY("MultiFamily"),
    PAD_SPLIT("PadSplit");

    @JsonValue
    private final String tag;

    /**
     * Resolves a stored tag to its strategy.
     *
     * @throws FieldValidationException on {@code analysis_type} if the tag is blank or unknown
     */
    @JsonCreator
    public static AnalysisType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw FieldValidationException.required("analysis_type");
        }
        return Arrays.stream(values())
                .filter(type -> type.tag.equals(tag.trim()))
                .findFirst()
                .orElseThrow(() -> new FieldValidationException("analysis_type", "unsupported strategy " + tag));
    }
}
