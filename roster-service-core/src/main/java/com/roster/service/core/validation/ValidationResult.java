package com.roster.service.core.validation;

/** Outcome of checking one submission. {@code violation} and {@code field} are null when valid. */
public record ValidationResult(Violation violation, String field) {

    private static final ValidationResult OK = new ValidationResult(null, null);

    public enum Violation {
        MISSING_FIELD("validation.missing-field"),
        NOT_NUMERIC("validation.not-numeric");

        private final String code;

        Violation(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult missingField(String field) {
        return new ValidationResult(Violation.MISSING_FIELD, field);
    }

    public static ValidationResult notNumeric(String field) {
        return new ValidationResult(Violation.NOT_NUMERIC, field);
    }

    public boolean valid() {
        return violation == null;
    }

    public String describe() {
        if (valid()) {
            return "valid";
        }
        return switch (violation) {
            case MISSING_FIELD -> "missing required field '" + field + "'";
            case NOT_NUMERIC -> "field '" + field + "' is not an integer";
        };
    }
}
