package com.abcft.pdfedit.core.zorder;

/**
 * Before and after values of one layer touched by a reorder.
 */
public final class ZChange {

    private final String layerId;
    private final int oldZ;
    private final int newZ;
    private final LayerLevel oldLevel;
    private final LayerLevel newLevel;
    private final long oldRank;
    private final long newRank;

    ZChange(String layerId, int oldZ, int newZ, LayerLevel oldLevel, LayerLevel newLevel,
            long oldRank, long newRank) {
        this.layerId = layerId;
        this.oldZ = oldZ;
        this.newZ = newZ;
        this.oldLevel = oldLevel;
        this.newLevel = newLevel;
        this.oldRank = oldRank;
        this.newRank = newRank;
    }

    public String getLayerId() {
        return layerId;
    }

    public int getOldZ() {
        return oldZ;
    }

    public int getNewZ() {
        return newZ;
    }

    public LayerLevel getOldLevel() {
        return oldLevel;
    }

    public LayerLevel getNewLevel() {
        return newLevel;
    }

    long getOldRank() {
        return oldRank;
    }

    long getNewRank() {
        return newRank;
    }

    @Override
    public String toString() {
        return layerId + ": " + oldZ + " -> " + newZ;
    }
}
