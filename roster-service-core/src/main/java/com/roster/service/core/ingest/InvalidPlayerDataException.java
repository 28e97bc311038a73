package com.roster.service.core.ingest;

import com.roster.service.core.validation.ValidationResult;

public class InvalidPlayerDataException extends IllegalArgumentException {

    private final transient ValidationResult result;

    public InvalidPlayerDataException(ValidationResult result) {
        super("Invalid player data: " + result.describe());
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }
}
