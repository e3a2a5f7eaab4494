package com.reitracker.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Raised when a deal, loan or calculation input is missing a required field or violates
 * a cross-field rule. The {@code field} uses the snake_case name of the stored record
 * (e.g., {@code after_repair_value}) so the web layer can map it back to a form input.
 *
 * <p>Always fatal to the single construction or operation that raised it: no partially
 * built object is ever returned.
 */
@Getter
public class FieldValidationException extends BaseException {

    private final String field;

    public FieldValidationException(String field, String message) {
        super(ErrorCode.VALIDATION_ERROR, field + ": " + message, Map.of("field", field));
        this.field = field;
    }

    public static FieldValidationException required(String field) {
        return new FieldValidationException(field, "is required");
    }
}
