package com.abcft.pdfedit.core.zorder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bounded undo/redo stack of reorders.
 *
 * <p>Entries before the cursor can be undone, entries at and after it redone. Recording a new
 * entry drops the redo branch; once the stack is full the oldest entry is dropped.</p>
 */
public class ReorderHistory {

    private final int maxSize;
    private final List<ReorderHistoryEntry> entries = new ArrayList<>();
    private int cursor;

    public ReorderHistory(int maxSize) {
        this.maxSize = Math.max(1, maxSize);
    }

    public void record(ReorderHistoryEntry entry) {
        while (entries.size() > cursor) {
            entries.remove(entries.size() - 1);
        }
        entries.add(entry);
        if (entries.size() > maxSize) {
            entries.remove(0);
        }
        cursor = entries.size();
    }

    public boolean canUndo() {
        return cursor > 0;
    }

    public boolean canRedo() {
        return cursor < entries.size();
    }

    /**
     * Moves the cursor back and returns the entry to revert, or {@code null}.
     */
    ReorderHistoryEntry undo() {
        if (!canUndo()) {
            return null;
        }
        return entries.get(--cursor);
    }

    /**
     * Moves the cursor forward and returns the entry to reapply, or {@code null}.
     */
    ReorderHistoryEntry redo() {
        if (!canRedo()) {
            return null;
        }
        return entries.get(cursor++);
    }

    /**
     * Forgets the changes made to a layer; entries left without changes are dropped.
     */
    void forgetLayer(String layerId) {
        for (int i = entries.size() - 1; i >= 0; --i) {
            ReorderHistoryEntry pruned = entries.get(i).without(layerId);
            if (null == pruned) {
                entries.remove(i);
                if (i < cursor) {
                    cursor--;
                }
            } else {
                entries.set(i, pruned);
            }
        }
    }

    public void clear() {
        entries.clear();
        cursor = 0;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Number of entries that can currently be undone.
     */
    public int getPosition() {
        return cursor;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public List<ReorderHistoryEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }
}
