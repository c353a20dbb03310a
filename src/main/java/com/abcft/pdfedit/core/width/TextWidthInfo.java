package com.abcft.pdfedit.core.width;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Measured width of a piece of text.
 */
public final class TextWidthInfo {

    private final String text;
    private final String fontName;
    private final double fontSize;
    private final List<GlyphWidth> glyphs;
    private final double totalWidthPoints;
    private final double totalWidthFontUnits;
    private final int spaceCount;

    TextWidthInfo(String text, String fontName, double fontSize, List<GlyphWidth> glyphs) {
        this.text = text;
        this.fontName = fontName;
        this.fontSize = fontSize;
        this.glyphs = ImmutableList.copyOf(glyphs);
        double units = 0;
        int spaces = 0;
        for (GlyphWidth glyph : glyphs) {
            units += glyph.widthFontUnits;
            if (glyph.whitespace) {
                spaces++;
            }
        }
        this.totalWidthFontUnits = units;
        this.totalWidthPoints = units / 1000.0 * fontSize;
        this.spaceCount = spaces;
    }

    public String getText() {
        return text;
    }

    public String getFontName() {
        return fontName;
    }

    public double getFontSize() {
        return fontSize;
    }

    public List<GlyphWidth> getGlyphs() {
        return glyphs;
    }

    public double getTotalWidthPoints() {
        return totalWidthPoints;
    }

    public double getTotalWidthFontUnits() {
        return totalWidthFontUnits;
    }

    /**
     * Number of characters (code points).
     */
    public int getCharCount() {
        return glyphs.size();
    }

    public int getSpaceCount() {
        return spaceCount;
    }

    public int getNonSpaceCount() {
        return glyphs.size() - spaceCount;
    }

    public double getNonSpaceWidth() {
        return glyphs.stream().filter(g -> !g.whitespace).mapToDouble(g -> g.widthPoints).sum();
    }

    public double getSpaceWidth() {
        return glyphs.stream().filter(g -> g.whitespace).mapToDouble(g -> g.widthPoints).sum();
    }

    public double getAverageCharWidth() {
        return glyphs.isEmpty() ? 0 : totalWidthPoints / glyphs.size();
    }

}
