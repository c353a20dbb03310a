package com.abcft.pdfedit.core.width;

import java.util.Locale;

/**
 * One element of a TJ array: either a string or a position adjustment in 1/1000 em.
 */
public final class TJArrayEntry {

    private final String text;
    private final double adjustment;

    private TJArrayEntry(String text, double adjustment) {
        this.text = text;
        this.adjustment = adjustment;
    }

    public static TJArrayEntry text(String text) {
        return new TJArrayEntry(text, 0);
    }

    /**
     * @param adjustment positive values move the next glyph left, negative values right.
     */
    public static TJArrayEntry adjustment(double adjustment) {
        return new TJArrayEntry(null, adjustment);
    }

    public boolean isText() {
        return text != null;
    }

    public String getText() {
        return text;
    }

    public double getAdjustment() {
        return adjustment;
    }

    public String toPdf() {
        if (isText()) {
            String escaped = text.replace("\\", "\\\\").replace("(", "\\(").replace(")", "\\)");
            return "(" + escaped + ")";
        }
        return String.format(Locale.ROOT, "%.2f", adjustment);
    }

    @Override
    public String toString() {
        return toPdf();
    }
}
