package com.abcft.pdfedit.core.width;

/**
 * How replacement text is made to occupy the original footprint.
 */
public enum FitStrategy {
    /** Spread the difference over word spacing and tracking, scaling as a last resort. */
    EXACT,
    /** Like {@link #EXACT}, but only when the new text is wider than the target. */
    COMPRESS,
    /** Like {@link #EXACT}, but only when the new text is narrower than the target. */
    EXPAND,
    TRUNCATE,
    ELLIPSIS,
    SCALE,
    ALLOW_OVERFLOW
}
