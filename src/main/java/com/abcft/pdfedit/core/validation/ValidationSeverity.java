package com.abcft.pdfedit.core.validation;

public enum ValidationSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /**
     * Whether an issue of this severity prevents saving.
     */
    public boolean isBlocking() {
        return this == ERROR || this == CRITICAL;
    }
}
