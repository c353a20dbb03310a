package com.abcft.pdfedit.core.zorder;

import com.abcft.pdfedit.core.model.Rectangle;

import java.awt.geom.Point2D;

/**
 * A layer registered with the {@link ZOrderManager}.
 *
 * <p>The stacking fields (z-order, level, group) are owned by the manager and only change through it.</p>
 */
public class LayerInfo {

    private final String id;
    private String name;
    private final int page;
    private int zOrder;
    private LayerLevel level;
    private final Rectangle bbox;
    private String groupId;
    private String parentId;
    private boolean visible = true;
    private boolean locked;
    private final long createdAt;
    private long modifiedAt;
    private final String sourceType;
    private final String sourceId;
    private final long sequence;
    private long rank;

    LayerInfo(String id, String name, int page, int zOrder, LayerLevel level, Rectangle bbox,
              String sourceType, String sourceId, long sequence) {
        this.id = id;
        this.name = name != null ? name : "Layer_" + id;
        this.page = page;
        this.zOrder = zOrder;
        this.level = level;
        this.bbox = new Rectangle(bbox);
        this.sourceType = sourceType;
        this.sourceId = sourceId;
        this.sequence = sequence;
        this.rank = sequence;
        this.createdAt = System.currentTimeMillis();
        this.modifiedAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
        touch();
    }

    public int getPage() {
        return page;
    }

    public int getZOrder() {
        return zOrder;
    }

    void setZOrder(int zOrder) {
        this.zOrder = zOrder;
    }

    public LayerLevel getLevel() {
        return level;
    }

    void setLevel(LayerLevel level) {
        this.level = level;
    }

    /**
     * Bounding box in page coordinates.
     */
    public Rectangle getBBox() {
        return new Rectangle(bbox);
    }

    Rectangle bbox() {
        return bbox;
    }

    /**
     * @return the id of the group the layer belongs to, or {@code null}.
     */
    public String getGroupId() {
        return groupId;
    }

    void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getParentId() {
        return parentId;
    }

    public void setParentId(String parentId) {
        this.parentId = parentId;
        touch();
    }

    public boolean isVisible() {
        return visible;
    }

    public void setVisible(boolean visible) {
        this.visible = visible;
        touch();
    }

    /**
     * Locked layers can be neither reordered nor removed.
     */
    public boolean isLocked() {
        return locked;
    }

    public void setLocked(boolean locked) {
        this.locked = locked;
        touch();
    }

    /**
     * Creation time in epoch millis.
     */
    public long getCreatedAt() {
        return createdAt;
    }

    public long getModifiedAt() {
        return modifiedAt;
    }

    public String getSourceType() {
        return sourceType;
    }

    public String getSourceId() {
        return sourceId;
    }

    /**
     * Registration order within the manager.
     */
    public long getSequence() {
        return sequence;
    }

    /**
     * Breaks ties between layers with the same z-order; larger values stack higher.
     * Starts as the registration sequence and is exchanged when tied layers swap places.
     */
    long getRank() {
        return rank;
    }

    void setRank(long rank) {
        this.rank = rank;
    }

    public double area() {
        return bbox.getArea();
    }

    public Point2D center() {
        return bbox.getCenter();
    }

    public boolean containsPoint(double x, double y) {
        return Rectangle.nearlyContains(bbox, x, y, 0);
    }

    public void touch() {
        modifiedAt = System.currentTimeMillis();
    }

    @Override
    public String toString() {
        return String.format("%s[%s, page=%d, z=%d, %s]", id, name, page, zOrder, level);
    }
}
