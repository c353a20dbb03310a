package com.abcft.pdfedit.core.overlay;

import com.google.common.base.MoreObjects;

import java.util.Collections;
import java.util.Map;

public final class OverlayStatistics {

    private final int total;
    private final int applied;
    private final int committed;
    private final Map<OverlayStrategy, Integer> byStrategy;
    private final Map<Integer, Integer> byPage;

    OverlayStatistics(int total, int applied, int committed,
                      Map<OverlayStrategy, Integer> byStrategy, Map<Integer, Integer> byPage) {
        this.total = total;
        this.applied = applied;
        this.committed = committed;
        this.byStrategy = Collections.unmodifiableMap(byStrategy);
        this.byPage = Collections.unmodifiableMap(byPage);
    }

    public int getTotal() {
        return total;
    }

    /**
     * Overlays drawn on their page, committed ones included.
     */
    public int getApplied() {
        return applied;
    }

    public int getCommitted() {
        return committed;
    }

    public Map<OverlayStrategy, Integer> getByStrategy() {
        return byStrategy;
    }

    /**
     * Overlay counts keyed by page index (0-based).
     */
    public Map<Integer, Integer> getByPage() {
        return byPage;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("total", total)
                .add("applied", applied)
                .add("committed", committed)
                .add("byStrategy", byStrategy)
                .add("byPage", byPage)
                .toString();
    }
}
