package com.abcft.pdfedit.core.zorder;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Layers that are reordered together.
 */
public class LayerGroup {

    private final String id;
    private final String name;
    private final Set<String> layerIds = new LinkedHashSet<>();
    private final long createdAt = System.currentTimeMillis();

    LayerGroup(String id, String name) {
        this.id = id;
        this.name = name != null ? name : "Group_" + id;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Set<String> getLayerIds() {
        return Collections.unmodifiableSet(layerIds);
    }

    public boolean contains(String layerId) {
        return layerIds.contains(layerId);
    }

    public int size() {
        return layerIds.size();
    }

    public boolean isEmpty() {
        return layerIds.isEmpty();
    }

    public long getCreatedAt() {
        return createdAt;
    }

    void add(String layerId) {
        layerIds.add(layerId);
    }

    void remove(String layerId) {
        layerIds.remove(layerId);
    }

    @Override
    public String toString() {
        return id + "[" + name + ", " + layerIds + "]";
    }
}
