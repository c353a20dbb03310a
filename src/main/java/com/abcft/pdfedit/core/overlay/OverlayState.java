package com.abcft.pdfedit.core.overlay;

/**
 * Lifecycle of an overlay: PREPARED, then APPLIED, then COMMITTED; PREPARED and APPLIED overlays
 * may be DISCARDED instead.
 */
public enum OverlayState {
    PREPARED,
    APPLIED,
    COMMITTED,
    DISCARDED;

    public boolean isTerminal() {
        return this == COMMITTED || this == DISCARDED;
    }

    public boolean canTransitionTo(OverlayState next) {
        switch (this) {
            case PREPARED:
                return next == APPLIED || next == DISCARDED;
            case APPLIED:
                return next == COMMITTED || next == DISCARDED;
            default:
                return false;
        }
    }
}
