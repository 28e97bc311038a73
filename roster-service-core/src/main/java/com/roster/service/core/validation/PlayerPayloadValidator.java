package com.roster.service.core.validation;

import com.roster.player.model.PlayerFields;
import java.util.Map;
import java.util.Objects;

/**
 * Checks that a submission carries every required field and that the player counts are integers.
 *
 * <p>Only absence fails the presence check: a key mapped to an empty string or to null is present. The payload is
 * never modified.
 */
public class PlayerPayloadValidator {

    private final NumericMode numericMode;

    public PlayerPayloadValidator(NumericMode numericMode) {
        this.numericMode = Objects.requireNonNull(numericMode, "numericMode");
    }

    public ValidationResult check(Map<String, ?> payload) {
        if (payload == null) {
            return ValidationResult.missingField(PlayerFields.REQUIRED.get(0));
        }
        for (String field : PlayerFields.REQUIRED) {
            if (!payload.containsKey(field)) {
                return ValidationResult.missingField(field);
            }
        }
        for (String field : PlayerFields.NUMERIC) {
            if (numericMode.parse(payload.get(field)).isEmpty()) {
                return ValidationResult.notNumeric(field);
            }
        }
        return ValidationResult.ok();
    }

    public NumericMode numericMode() {
        return numericMode;
    }
}
