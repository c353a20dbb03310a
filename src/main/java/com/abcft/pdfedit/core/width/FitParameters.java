package com.abcft.pdfedit.core.width;

import com.abcft.pdfedit.core.EditParameters;
import com.abcft.pdfedit.core.util.MapUtils;

import java.util.Map;

/**
 * Parameters for width fitting.
 */
public final class FitParameters extends EditParameters {

    public static final FitParameters DEFAULT = new Builder().build();

    public static final class Builder extends EditParameters.Builder<FitParameters> {

        FitStrategy defaultStrategy = FitStrategy.EXACT;
        float widthTolerance = 0.5f;
        float minTracking = -3.0f;
        float maxTracking = 5.0f;
        float minWordSpacing = -5.0f;
        float maxWordSpacing = 10.0f;
        float minHorizontalScale = 50.0f;
        float maxHorizontalScale = 150.0f;
        boolean preferWordSpacing = true;
        String ellipsis = "...";
        boolean truncateAtWord = true;

        public Builder() {
        }

        public Builder(Map<String, String> params) {
            super(params);
            this.defaultStrategy = MapUtils.getEnum(params, "fit.strategy", FitStrategy.class, defaultStrategy);
            this.widthTolerance = MapUtils.getFloat(params, "fit.tolerance", widthTolerance);
            this.minTracking = MapUtils.getFloat(params, "fit.minTracking", minTracking);
            this.maxTracking = MapUtils.getFloat(params, "fit.maxTracking", maxTracking);
            this.minWordSpacing = MapUtils.getFloat(params, "fit.minWordSpacing", minWordSpacing);
            this.maxWordSpacing = MapUtils.getFloat(params, "fit.maxWordSpacing", maxWordSpacing);
            this.minHorizontalScale = MapUtils.getFloat(params, "fit.minScale", minHorizontalScale);
            this.maxHorizontalScale = MapUtils.getFloat(params, "fit.maxScale", maxHorizontalScale);
            this.preferWordSpacing = MapUtils.getBoolean(params, "fit.preferWordSpacing", preferWordSpacing);
            this.ellipsis = MapUtils.getString(params, "fit.ellipsis", ellipsis);
            this.truncateAtWord = MapUtils.getBoolean(params, "fit.truncateAtWord", truncateAtWord);
        }

        public Builder setDefaultStrategy(FitStrategy defaultStrategy) {
            this.defaultStrategy = defaultStrategy;
            return this;
        }

        public Builder setWidthTolerance(float widthTolerance) {
            this.widthTolerance = widthTolerance;
            return this;
        }

        public Builder setTrackingRange(float min, float max) {
            this.minTracking = min;
            this.maxTracking = max;
            return this;
        }

        public Builder setWordSpacingRange(float min, float max) {
            this.minWordSpacing = min;
            this.maxWordSpacing = max;
            return this;
        }

        public Builder setHorizontalScaleRange(float min, float max) {
            this.minHorizontalScale = min;
            this.maxHorizontalScale = max;
            return this;
        }

        public Builder setPreferWordSpacing(boolean preferWordSpacing) {
            this.preferWordSpacing = preferWordSpacing;
            return this;
        }

        public Builder setEllipsis(String ellipsis) {
            this.ellipsis = ellipsis;
            return this;
        }

        public Builder setTruncateAtWord(boolean truncateAtWord) {
            this.truncateAtWord = truncateAtWord;
            return this;
        }

        @Override
        public FitParameters build() {
            return new FitParameters(this);
        }
    }

    private FitParameters(Builder builder) {
        super(builder);
        this.defaultStrategy = builder.defaultStrategy;
        this.widthTolerance = builder.widthTolerance;
        this.minTracking = builder.minTracking;
        this.maxTracking = builder.maxTracking;
        this.minWordSpacing = builder.minWordSpacing;
        this.maxWordSpacing = builder.maxWordSpacing;
        this.minHorizontalScale = builder.minHorizontalScale;
        this.maxHorizontalScale = builder.maxHorizontalScale;
        this.preferWordSpacing = builder.preferWordSpacing;
        this.ellipsis = builder.ellipsis;
        this.truncateAtWord = builder.truncateAtWord;
    }

    @Override
    public FitParameters.Builder buildUpon() {
        return buildUpon(new FitParameters.Builder())
                .setDefaultStrategy(defaultStrategy)
                .setWidthTolerance(widthTolerance)
                .setTrackingRange(minTracking, maxTracking)
                .setWordSpacingRange(minWordSpacing, maxWordSpacing)
                .setHorizontalScaleRange(minHorizontalScale, maxHorizontalScale)
                .setPreferWordSpacing(preferWordSpacing)
                .setEllipsis(ellipsis)
                .setTruncateAtWord(truncateAtWord);
    }

    public final FitStrategy defaultStrategy;
    /**
     * Width difference (points) considered a perfect fit.
     */
    public final float widthTolerance;
    public final float minTracking;
    public final float maxTracking;
    public final float minWordSpacing;
    public final float maxWordSpacing;
    /**
     * Horizontal scale bounds, in percent.
     */
    public final float minHorizontalScale;
    public final float maxHorizontalScale;
    public final boolean preferWordSpacing;
    public final String ellipsis;
    public final boolean truncateAtWord;

}
