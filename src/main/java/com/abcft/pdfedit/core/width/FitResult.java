package com.abcft.pdfedit.core.width;

public enum FitResult {
    SUCCESS,
    COMPRESSED,
    EXPANDED,
    TRUNCATED,
    SCALED,
    OVERFLOW,
    FAILED;

    public boolean isSuccess() {
        return this == SUCCESS || this == COMPRESSED || this == EXPANDED || this == SCALED;
    }
}
