package com.abcft.pdfedit.core.width;

import java.util.OptionalDouble;

/**
 * Source of real glyph widths, supplied by the host document.
 */
public interface FontMetricsProvider {

    /**
     * Look up the advance width of a character.
     *
     * @param fontName the font name as it appears on the page (resource or base name).
     * @param codePoint the unicode code point to measure.
     * @param pageIndex the index (0-based) of the page the font is used on.
     * @return the width in 1/1000 em, or empty if the font or glyph is unknown.
     */
    OptionalDouble getGlyphWidth(String fontName, int codePoint, int pageIndex);

}
