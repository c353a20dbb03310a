package com.abcft.pdfedit.core.overlay;

public enum RewriteStatus {
    SUCCESS,
    PARTIAL_SUCCESS,
    FAILED,
    FONT_SUBSTITUTED,
    TEXT_TRUNCATED,
    POSITION_ADJUSTED;

    public boolean isFailure() {
        return this == FAILED;
    }
}
