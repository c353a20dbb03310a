package com.abcft.pdfedit.core.width;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Text state changes (Tc, Tw, Tz and kerning) computed for a fit.
 */
public final class SpacingAdjustment {

    public static final SpacingAdjustment NONE = builder(AdjustmentType.NONE).build();

    /**
     * A position adjustment after the character at {@code charIndex}, in 1/1000 em.
     */
    public static final class KerningPair {
        public final int charIndex;
        public final double adjustment;

        public KerningPair(int charIndex, double adjustment) {
            this.charIndex = charIndex;
            this.adjustment = adjustment;
        }
    }

    private final AdjustmentType type;
    private final double tracking;
    private final double wordSpacing;
    private final double horizontalScale;
    private final List<KerningPair> kerningPairs;
    private final double totalAdjustment;
    private final double adjustmentPerChar;
    private final double adjustmentPerSpace;

    private SpacingAdjustment(Builder builder) {
        this.type = builder.type;
        this.tracking = builder.tracking;
        this.wordSpacing = builder.wordSpacing;
        this.horizontalScale = builder.horizontalScale;
        this.kerningPairs = ImmutableList.copyOf(builder.kerningPairs);
        this.totalAdjustment = builder.totalAdjustment;
        this.adjustmentPerChar = builder.adjustmentPerChar;
        this.adjustmentPerSpace = builder.adjustmentPerSpace;
    }

    public static Builder builder(AdjustmentType type) {
        return new Builder(type);
    }

    public AdjustmentType getType() {
        return type;
    }

    /**
     * Extra space between characters (Tc), in unscaled text space units.
     */
    public double getTracking() {
        return tracking;
    }

    /**
     * Extra space at each space character (Tw), in unscaled text space units.
     */
    public double getWordSpacing() {
        return wordSpacing;
    }

    /**
     * Horizontal scale (Tz) in percent.
     */
    public double getHorizontalScale() {
        return horizontalScale;
    }

    public List<KerningPair> getKerningPairs() {
        return kerningPairs;
    }

    public double getTotalAdjustment() {
        return totalAdjustment;
    }

    public double getAdjustmentPerChar() {
        return adjustmentPerChar;
    }

    public double getAdjustmentPerSpace() {
        return adjustmentPerSpace;
    }

    public boolean hasAdjustment() {
        return tracking != 0 || wordSpacing != 0 || horizontalScale != 100.0 || !kerningPairs.isEmpty();
    }

    /**
     * Content stream operators that apply this adjustment, e.g. {@code "0.2500 Tc"}.
     */
    public List<String> toPdfOperators() {
        List<String> operators = new ArrayList<>(3);
        if (tracking != 0) {
            operators.add(String.format(Locale.ROOT, "%.4f Tc", tracking));
        }
        if (wordSpacing != 0) {
            operators.add(String.format(Locale.ROOT, "%.4f Tw", wordSpacing));
        }
        if (horizontalScale != 100.0) {
            operators.add(String.format(Locale.ROOT, "%.4f Tz", horizontalScale));
        }
        return operators;
    }

    @Override
    public String toString() {
        return type + String.valueOf(toPdfOperators());
    }

    public static final class Builder {
        private final AdjustmentType type;
        private double tracking;
        private double wordSpacing;
        private double horizontalScale = 100.0;
        private final List<KerningPair> kerningPairs = new ArrayList<>();
        private double totalAdjustment;
        private double adjustmentPerChar;
        private double adjustmentPerSpace;

        private Builder(AdjustmentType type) {
            this.type = type;
        }

        public Builder tracking(double tracking) {
            this.tracking = tracking;
            this.adjustmentPerChar = tracking;
            return this;
        }

        public Builder wordSpacing(double wordSpacing) {
            this.wordSpacing = wordSpacing;
            this.adjustmentPerSpace = wordSpacing;
            return this;
        }

        public Builder horizontalScale(double horizontalScale) {
            this.horizontalScale = horizontalScale;
            return this;
        }

        public Builder kerning(int charIndex, double adjustment) {
            this.kerningPairs.add(new KerningPair(charIndex, adjustment));
            return this;
        }

        public Builder totalAdjustment(double totalAdjustment) {
            this.totalAdjustment = totalAdjustment;
            return this;
        }

        public SpacingAdjustment build() {
            return new SpacingAdjustment(this);
        }
    }
}
