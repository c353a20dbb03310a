package com.abcft.pdfedit.core.overlay;

import com.abcft.pdfedit.core.EditParameters;
import com.abcft.pdfedit.core.gson.GsonUtil;
import com.abcft.pdfedit.core.util.MapUtils;
import com.abcft.pdfedit.core.width.FitStrategy;

import java.awt.Color;
import java.util.Map;

/**
 * Parameters of the {@link SafeTextRewriter}.
 */
public final class RewriteParameters extends EditParameters {

    public static final RewriteParameters DEFAULT = new Builder().build();

    public static final class Builder extends EditParameters.Builder<RewriteParameters> {

        float redactMargin = 1.0f;
        OverlayStrategy defaultStrategy = OverlayStrategy.REDACT_THEN_INSERT;
        RewriteMode defaultMode = RewriteMode.PRESERVE_POSITION;
        FitStrategy fitStrategy = FitStrategy.EXACT;
        Color redactionFill = Color.WHITE;

        public Builder() {
        }

        public Builder(Map<String, String> params) {
            super(params);
            this.redactMargin = MapUtils.getFloat(params, "rewrite.redactMargin", redactMargin);
            this.defaultStrategy = MapUtils.getEnum(params, "rewrite.strategy", OverlayStrategy.class, defaultStrategy);
            this.defaultMode = MapUtils.getEnum(params, "rewrite.mode", RewriteMode.class, defaultMode);
            this.fitStrategy = MapUtils.getEnum(params, "rewrite.fitStrategy", FitStrategy.class, fitStrategy);
            String fill = MapUtils.getString(params, "rewrite.redactionFill", null);
            if (fill != null) {
                this.redactionFill = GsonUtil.string2Color(fill);
            }
        }

        public Builder setRedactMargin(float redactMargin) {
            this.redactMargin = redactMargin;
            return this;
        }

        public Builder setDefaultStrategy(OverlayStrategy defaultStrategy) {
            this.defaultStrategy = defaultStrategy;
            return this;
        }

        public Builder setDefaultMode(RewriteMode defaultMode) {
            this.defaultMode = defaultMode;
            return this;
        }

        public Builder setFitStrategy(FitStrategy fitStrategy) {
            this.fitStrategy = fitStrategy;
            return this;
        }

        public Builder setRedactionFill(Color redactionFill) {
            this.redactionFill = redactionFill;
            return this;
        }

        @Override
        public RewriteParameters build() {
            return new RewriteParameters(this);
        }
    }

    private RewriteParameters(Builder builder) {
        super(builder);
        this.redactMargin = builder.redactMargin;
        this.defaultStrategy = builder.defaultStrategy;
        this.defaultMode = builder.defaultMode;
        this.fitStrategy = builder.fitStrategy;
        this.redactionFill = builder.redactionFill;
    }

    @Override
    public RewriteParameters.Builder buildUpon() {
        return buildUpon(new RewriteParameters.Builder())
                .setRedactMargin(redactMargin)
                .setDefaultStrategy(defaultStrategy)
                .setDefaultMode(defaultMode)
                .setFitStrategy(fitStrategy)
                .setRedactionFill(redactionFill);
    }

    /**
     * Points added on every side of the original box for redaction and background layers.
     */
    public final float redactMargin;
    public final OverlayStrategy defaultStrategy;
    public final RewriteMode defaultMode;
    /**
     * Fit strategy used by {@link RewriteMode#ADJUST_TO_FIT}.
     */
    public final FitStrategy fitStrategy;
    /**
     * Fill painted over redacted areas, {@code null} for none.
     */
    public final Color redactionFill;

}
