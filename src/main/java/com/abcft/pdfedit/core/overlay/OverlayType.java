package com.abcft.pdfedit.core.overlay;

import com.abcft.pdfedit.core.zorder.LayerLevel;

public enum OverlayType {
    TEXT(LayerLevel.TEXT),
    BACKGROUND(LayerLevel.TEXT_BACKGROUND),
    REDACTION(LayerLevel.REDACTION),
    SHAPE(LayerLevel.FILL),
    IMAGE(LayerLevel.CONTENT_BASE);

    private final LayerLevel layerLevel;

    OverlayType(LayerLevel layerLevel) {
        this.layerLevel = layerLevel;
    }

    /**
     * The level layers of this type are registered at.
     */
    public LayerLevel getLayerLevel() {
        return layerLevel;
    }
}
