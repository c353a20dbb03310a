package com.abcft.pdfedit.core.zorder;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

public final class ZOrderStatistics {

    private final int totalLayers;
    private final int pages;
    private final int groups;
    private final Map<LayerLevel, Integer> layersByLevel;
    private final int historySize;
    private final int historyPosition;

    ZOrderStatistics(int totalLayers, int pages, int groups, Map<LayerLevel, Integer> layersByLevel,
                     int historySize, int historyPosition) {
        this.totalLayers = totalLayers;
        this.pages = pages;
        this.groups = groups;
        this.layersByLevel = ImmutableMap.copyOf(layersByLevel);
        this.historySize = historySize;
        this.historyPosition = historyPosition;
    }

    public int getTotalLayers() {
        return totalLayers;
    }

    public int getPages() {
        return pages;
    }

    public int getGroups() {
        return groups;
    }

    public Map<LayerLevel, Integer> getLayersByLevel() {
        return layersByLevel;
    }

    public int getHistorySize() {
        return historySize;
    }

    public int getHistoryPosition() {
        return historyPosition;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("layers", totalLayers)
                .add("pages", pages)
                .add("groups", groups)
                .add("byLevel", layersByLevel)
                .add("history", historyPosition + "/" + historySize)
                .toString();
    }
}
