package com.abcft.pdfedit.core.zorder;

import java.util.Objects;

/**
 * Key of the per page and level z-order counters.
 */
final class PageLevelKey {

    private final int page;
    private final LayerLevel level;

    PageLevelKey(int page, LayerLevel level) {
        this.page = page;
        this.level = level;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PageLevelKey)) {
            return false;
        }
        PageLevelKey that = (PageLevelKey) o;
        return page == that.page && level == that.level;
    }

    @Override
    public int hashCode() {
        return Objects.hash(page, level);
    }

    @Override
    public String toString() {
        return page + "/" + level;
    }
}
