package com.abcft.pdfedit.core.width;

import java.util.Objects;

/**
 * Cache key of a font as used on one page.
 */
public final class FontKey {

    /**
     * Page index matching fonts registered for every page.
     */
    public static final int ANY_PAGE = -1;

    private final String fontName;
    private final int pageIndex;

    public FontKey(String fontName, int pageIndex) {
        this.fontName = Objects.requireNonNull(fontName, "fontName");
        this.pageIndex = pageIndex;
    }

    public String getFontName() {
        return fontName;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FontKey)) {
            return false;
        }
        FontKey other = (FontKey) o;
        return pageIndex == other.pageIndex && fontName.equals(other.fontName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fontName, pageIndex);
    }

    @Override
    public String toString() {
        return fontName + "@" + pageIndex;
    }
}
