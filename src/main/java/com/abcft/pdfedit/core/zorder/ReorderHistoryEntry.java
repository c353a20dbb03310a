package com.abcft.pdfedit.core.zorder;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One undoable reorder.
 *
 * <p>{@link #getLayerId()} and the old/new values describe the layer the action was asked for
 * (the group id for {@link ReorderOperation#GROUP}); {@link #getChanges()} lists every layer it touched.</p>
 */
public final class ReorderHistoryEntry {

    private final ReorderOperation operation;
    private final String layerId;
    private final int oldZ;
    private final int newZ;
    private final LayerLevel oldLevel;
    private final LayerLevel newLevel;
    private final List<ZChange> changes;
    private final long timestamp;

    ReorderHistoryEntry(ReorderOperation operation, String layerId, List<ZChange> changes) {
        this(operation, layerId, changes, System.currentTimeMillis());
    }

    private ReorderHistoryEntry(ReorderOperation operation, String layerId, List<ZChange> changes, long timestamp) {
        this.operation = operation;
        this.timestamp = timestamp;
        this.layerId = layerId;
        this.changes = ImmutableList.copyOf(changes);
        ZChange primary = this.changes.stream()
                .filter(change -> change.getLayerId().equals(layerId))
                .findFirst()
                .orElse(this.changes.isEmpty() ? null : this.changes.get(0));
        this.oldZ = primary != null ? primary.getOldZ() : 0;
        this.newZ = primary != null ? primary.getNewZ() : 0;
        this.oldLevel = primary != null ? primary.getOldLevel() : null;
        this.newLevel = primary != null ? primary.getNewLevel() : null;
    }

    public ReorderOperation getOperation() {
        return operation;
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

    public List<ZChange> getChanges() {
        return changes;
    }

    /**
     * This entry without the changes made to a layer, or {@code null} if no other change is left.
     */
    ReorderHistoryEntry without(String id) {
        List<ZChange> kept = changes.stream()
                .filter(change -> !change.getLayerId().equals(id))
                .collect(Collectors.toList());
        if (kept.isEmpty()) {
            return null;
        }
        return kept.size() == changes.size() ? this : new ReorderHistoryEntry(operation, layerId, kept, timestamp);
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return operation + "(" + layerId + ") " + changes;
    }
}
