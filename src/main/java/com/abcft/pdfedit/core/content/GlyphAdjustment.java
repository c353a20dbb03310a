package com.abcft.pdfedit.core.content;

/**
 * A number inside a TJ array, in thousandths of text space.
 */
public final class GlyphAdjustment {

    private final int charIndex;
    private final double amount;

    public GlyphAdjustment(int charIndex, double amount) {
        this.charIndex = charIndex;
        this.amount = amount;
    }

    /**
     * Number of characters shown before this adjustment.
     */
    public int getCharIndex() {
        return charIndex;
    }

    public double getAmount() {
        return amount;
    }

    /**
     * Horizontal displacement in unscaled text space; positive amounts move left.
     */
    public double toPoints(double fontSize) {
        return -amount / 1000.0 * fontSize;
    }

    @Override
    public String toString() {
        return charIndex + ":" + amount;
    }
}
