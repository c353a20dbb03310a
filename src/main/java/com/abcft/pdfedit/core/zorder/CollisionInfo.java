package com.abcft.pdfedit.core.zorder;

import com.abcft.pdfedit.core.model.Rectangle;

/**
 * How two layers overlap.
 */
public final class CollisionInfo {

    private final String layerA;
    private final String layerB;
    private final CollisionType type;
    private final Rectangle overlap;
    private final double overlapArea;
    private final double overlapPercent;

    CollisionInfo(String layerA, String layerB, CollisionType type, Rectangle overlap,
                  double overlapArea, double overlapPercent) {
        this.layerA = layerA;
        this.layerB = layerB;
        this.type = type;
        this.overlap = overlap;
        this.overlapArea = overlapArea;
        this.overlapPercent = overlapPercent;
    }

    static CollisionInfo none(String layerA, String layerB) {
        return new CollisionInfo(layerA, layerB, CollisionType.NONE, null, 0, 0);
    }

    public String getLayerA() {
        return layerA;
    }

    public String getLayerB() {
        return layerB;
    }

    public CollisionType getType() {
        return type;
    }

    /**
     * @return the intersection, or {@code null} when the layers do not overlap.
     */
    public Rectangle getOverlap() {
        return overlap;
    }

    public double getOverlapArea() {
        return overlapArea;
    }

    /**
     * Overlap area relative to the smaller of the two boxes.
     */
    public double getOverlapPercent() {
        return overlapPercent;
    }

    public boolean isCollision() {
        return type != CollisionType.NONE;
    }

    @Override
    public String toString() {
        return String.format("%s/%s: %s (%.1f%%)", layerA, layerB, type, overlapPercent);
    }
}
