package com.abcft.pdfedit.core.validation;

public enum ValidationResult {
    VALID,
    VALID_WITH_WARNINGS,
    INVALID,
    /**
     * Validation has not completed.
     */
    UNKNOWN;

    public boolean isValid() {
        return this == VALID || this == VALID_WITH_WARNINGS;
    }
}
