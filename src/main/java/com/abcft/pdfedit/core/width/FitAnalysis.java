package com.abcft.pdfedit.core.width;

import com.abcft.pdfedit.core.gson.GsonUtil;
import org.apache.commons.math3.util.FastMath;

/**
 * Outcome of fitting replacement text into a target width.
 */
public final class FitAnalysis {

    private final String originalText;
    private final String newText;
    private final double originalWidth;
    private final double naturalWidth;
    private final double targetWidth;
    private final double widthDifference;
    private final double widthRatio;
    private final FitStrategy strategy;
    private final FitResult result;
    private final SpacingAdjustment adjustment;
    private final String finalText;
    private final double finalWidth;
    private final double overflowAmount;
    private final double compressionPercent;

    private FitAnalysis(Builder builder) {
        this.originalText = builder.originalText;
        this.newText = builder.newText;
        this.originalWidth = builder.originalWidth;
        this.naturalWidth = builder.naturalWidth;
        this.targetWidth = builder.targetWidth;
        this.widthDifference = builder.widthDifference;
        this.widthRatio = builder.widthRatio;
        this.strategy = builder.strategy;
        this.result = builder.result;
        this.adjustment = builder.adjustment;
        this.finalText = builder.finalText != null ? builder.finalText : builder.newText;
        this.finalWidth = builder.finalWidth;
        this.overflowAmount = builder.overflowAmount;
        this.compressionPercent = builder.compressionPercent;
    }

    public String getOriginalText() {
        return originalText;
    }

    public String getNewText() {
        return newText;
    }

    public double getOriginalWidth() {
        return originalWidth;
    }

    /**
     * Width of the new text without any adjustment.
     */
    public double getNaturalWidth() {
        return naturalWidth;
    }

    public double getTargetWidth() {
        return targetWidth;
    }

    /**
     * Natural width minus target width; positive when the new text is too wide.
     */
    public double getWidthDifference() {
        return widthDifference;
    }

    public double getWidthRatio() {
        return widthRatio;
    }

    public FitStrategy getStrategy() {
        return strategy;
    }

    public FitResult getResult() {
        return result;
    }

    /**
     * @return the spacing adjustment, or {@code null} if none was computed.
     */
    public SpacingAdjustment getAdjustment() {
        return adjustment;
    }

    public String getFinalText() {
        return finalText;
    }

    public double getFinalWidth() {
        return finalWidth;
    }

    public double getOverflowAmount() {
        return overflowAmount;
    }

    public double getCompressionPercent() {
        return compressionPercent;
    }

    public boolean isSuccess() {
        return result.isSuccess();
    }

    public boolean fitsExactly() {
        return FastMath.abs(finalWidth - targetWidth) < 0.1;
    }

    public String toJson() {
        return GsonUtil.DEFAULT.toJson(this);
    }

    @Override
    public String toString() {
        return String.format("FitAnalysis[%s -> %s, natural=%.2f, target=%.2f, final=%.2f]",
                strategy, result, naturalWidth, targetWidth, finalWidth);
    }

    static final class Builder {
        private final String originalText;
        private final String newText;
        private final double originalWidth;
        private final double naturalWidth;
        private final double targetWidth;
        private final double widthDifference;
        private final double widthRatio;
        private final FitStrategy strategy;
        private FitResult result = FitResult.FAILED;
        private SpacingAdjustment adjustment;
        private String finalText;
        private double finalWidth;
        private double overflowAmount;
        private double compressionPercent;

        Builder(String originalText, String newText, double originalWidth, double naturalWidth,
                double targetWidth, FitStrategy strategy) {
            this.originalText = originalText;
            this.newText = newText;
            this.originalWidth = originalWidth;
            this.naturalWidth = naturalWidth;
            this.targetWidth = targetWidth;
            this.widthDifference = naturalWidth - targetWidth;
            this.widthRatio = targetWidth > 0 ? naturalWidth / targetWidth : 1.0;
            this.strategy = strategy;
        }

        double widthDifference() {
            return widthDifference;
        }

        double naturalWidth() {
            return naturalWidth;
        }

        double targetWidth() {
            return targetWidth;
        }

        String newText() {
            return newText;
        }

        Builder result(FitResult result) {
            this.result = result;
            return this;
        }

        Builder adjustment(SpacingAdjustment adjustment) {
            this.adjustment = adjustment;
            return this;
        }

        Builder finalText(String finalText) {
            this.finalText = finalText;
            return this;
        }

        Builder finalWidth(double finalWidth) {
            this.finalWidth = finalWidth;
            return this;
        }

        Builder overflowAmount(double overflowAmount) {
            this.overflowAmount = overflowAmount;
            return this;
        }

        Builder compressionPercent(double compressionPercent) {
            this.compressionPercent = compressionPercent;
            return this;
        }

        FitAnalysis build() {
            return new FitAnalysis(this);
        }
    }
}
