package com.abcft.pdfedit.core.validation;

import java.util.Objects;

/**
 * A font used by a page.
 */
public final class FontReference {

    private final String name;
    private final int pageIndex;
    private final boolean embedded;
    private final boolean subset;

    public FontReference(String name, int pageIndex, boolean embedded, boolean subset) {
        this.name = name;
        this.pageIndex = pageIndex;
        this.embedded = embedded;
        this.subset = subset;
    }

    /**
     * Base font name, subset tag included.
     */
    public String getName() {
        return name;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public boolean isEmbedded() {
        return embedded;
    }

    public boolean isSubset() {
        return subset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FontReference that = (FontReference) o;
        return pageIndex == that.pageIndex && embedded == that.embedded && subset == that.subset
                && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, pageIndex, embedded, subset);
    }

    @Override
    public String toString() {
        return String.format("%s@%d%s", name, pageIndex + 1, embedded ? "[embedded]" : "");
    }
}
