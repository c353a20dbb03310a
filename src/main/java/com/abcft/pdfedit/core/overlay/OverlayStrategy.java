package com.abcft.pdfedit.core.overlay;

/**
 * How replacement text is put over the original.
 */
public enum OverlayStrategy {
    /**
     * Remove the original text operators under the box, paint the fill, then draw the new text.
     */
    REDACT_THEN_INSERT,
    /**
     * Cover the original with an opaque white box and draw the new text on it.
     */
    WHITE_BACKGROUND,
    /**
     * Remove the original text operators without painting anything, then draw the new text.
     */
    TRANSPARENT_ERASE,
    /**
     * Draw the new text over the untouched original.
     */
    DIRECT_OVERLAY,
    /**
     * Edit the text operators in place. Refused by {@link SafeTextRewriter}.
     */
    CONTENT_STREAM_EDIT;

    public boolean isSafe() {
        return this != CONTENT_STREAM_EDIT;
    }

    public boolean preservesOriginal() {
        return this == DIRECT_OVERLAY;
    }
}
