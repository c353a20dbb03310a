package com.abcft.pdfedit.core.zorder;

import com.abcft.pdfedit.core.EditParameters;
import com.abcft.pdfedit.core.util.MapUtils;

import java.util.Map;

/**
 * Parameters of the {@link ZOrderManager}.
 */
public final class ZOrderParameters extends EditParameters {

    public static final ZOrderParameters DEFAULT = new Builder().build();

    public static final class Builder extends EditParameters.Builder<ZOrderParameters> {

        boolean maintainLevelBoundaries = true;
        boolean allowCrossLevelMovement = false;
        int maxLayersPerPage = 1000;
        int zOrderStep = 10;
        boolean enableHistory = true;
        int maxHistory = 100;
        float collisionTolerance = 0.5f;

        public Builder() {
        }

        public Builder(Map<String, String> params) {
            super(params);
            this.maintainLevelBoundaries = MapUtils.getBoolean(params, "zorder.maintainLevelBoundaries", maintainLevelBoundaries);
            this.allowCrossLevelMovement = MapUtils.getBoolean(params, "zorder.allowCrossLevelMovement", allowCrossLevelMovement);
            this.maxLayersPerPage = MapUtils.getInt(params, "zorder.maxLayersPerPage", maxLayersPerPage);
            this.zOrderStep = MapUtils.getInt(params, "zorder.step", zOrderStep);
            this.enableHistory = MapUtils.getBoolean(params, "zorder.history", enableHistory);
            this.maxHistory = MapUtils.getInt(params, "zorder.maxHistory", maxHistory);
            this.collisionTolerance = MapUtils.getFloat(params, "zorder.collisionTolerance", collisionTolerance);
        }

        public Builder setMaintainLevelBoundaries(boolean maintainLevelBoundaries) {
            this.maintainLevelBoundaries = maintainLevelBoundaries;
            return this;
        }

        public Builder setAllowCrossLevelMovement(boolean allowCrossLevelMovement) {
            this.allowCrossLevelMovement = allowCrossLevelMovement;
            return this;
        }

        public Builder setMaxLayersPerPage(int maxLayersPerPage) {
            this.maxLayersPerPage = maxLayersPerPage;
            return this;
        }

        public Builder setZOrderStep(int zOrderStep) {
            this.zOrderStep = zOrderStep;
            return this;
        }

        public Builder setEnableHistory(boolean enableHistory) {
            this.enableHistory = enableHistory;
            return this;
        }

        public Builder setMaxHistory(int maxHistory) {
            this.maxHistory = maxHistory;
            return this;
        }

        public Builder setCollisionTolerance(float collisionTolerance) {
            this.collisionTolerance = collisionTolerance;
            return this;
        }

        @Override
        public ZOrderParameters build() {
            return new ZOrderParameters(this);
        }
    }

    private ZOrderParameters(Builder builder) {
        super(builder);
        this.maintainLevelBoundaries = builder.maintainLevelBoundaries;
        this.allowCrossLevelMovement = builder.allowCrossLevelMovement;
        this.maxLayersPerPage = builder.maxLayersPerPage;
        this.zOrderStep = builder.zOrderStep;
        this.enableHistory = builder.enableHistory;
        this.maxHistory = builder.maxHistory;
        this.collisionTolerance = builder.collisionTolerance;
    }

    @Override
    public ZOrderParameters.Builder buildUpon() {
        return buildUpon(new ZOrderParameters.Builder())
                .setMaintainLevelBoundaries(maintainLevelBoundaries)
                .setAllowCrossLevelMovement(allowCrossLevelMovement)
                .setMaxLayersPerPage(maxLayersPerPage)
                .setZOrderStep(zOrderStep)
                .setEnableHistory(enableHistory)
                .setMaxHistory(maxHistory)
                .setCollisionTolerance(collisionTolerance);
    }

    /**
     * Keep reorders inside the layer's own level.
     */
    public final boolean maintainLevelBoundaries;
    public final boolean allowCrossLevelMovement;
    public final int maxLayersPerPage;
    public final int zOrderStep;
    public final boolean enableHistory;
    public final int maxHistory;
    /**
     * Edge tolerance (points) of collision detection.
     */
    public final float collisionTolerance;

}
