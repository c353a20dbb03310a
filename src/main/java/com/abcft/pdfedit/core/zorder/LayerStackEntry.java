package com.abcft.pdfedit.core.zorder;

import com.abcft.pdfedit.core.model.Rectangle;

/**
 * Read-only view of a layer at a position of a page's stack; position 0 is the bottom.
 */
public final class LayerStackEntry {

    private final int position;
    private final String id;
    private final String name;
    private final int zOrder;
    private final LayerLevel level;
    private final Rectangle bbox;
    private final String groupId;
    private final boolean visible;
    private final boolean locked;
    private final String sourceType;

    LayerStackEntry(int position, LayerInfo layer) {
        this.position = position;
        this.id = layer.getId();
        this.name = layer.getName();
        this.zOrder = layer.getZOrder();
        this.level = layer.getLevel();
        this.bbox = layer.getBBox();
        this.groupId = layer.getGroupId();
        this.visible = layer.isVisible();
        this.locked = layer.isLocked();
        this.sourceType = layer.getSourceType();
    }

    public int getPosition() {
        return position;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getZOrder() {
        return zOrder;
    }

    public LayerLevel getLevel() {
        return level;
    }

    public Rectangle getBBox() {
        return bbox;
    }

    public String getGroupId() {
        return groupId;
    }

    public boolean isVisible() {
        return visible;
    }

    public boolean isLocked() {
        return locked;
    }

    public String getSourceType() {
        return sourceType;
    }
}
