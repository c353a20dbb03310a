package com.abcft.pdfedit.core.width;

/**
 * Width of one character.
 */
public final class GlyphWidth {

    public final int codePoint;
    public final double widthFontUnits;
    public final double widthPoints;
    public final boolean whitespace;

    public GlyphWidth(int codePoint, double widthFontUnits, double widthPoints) {
        this.codePoint = codePoint;
        this.widthFontUnits = widthFontUnits;
        this.widthPoints = widthPoints;
        this.whitespace = Character.isWhitespace(codePoint);
    }

    public String getCharacter() {
        return new String(Character.toChars(codePoint));
    }

    public boolean isSpace() {
        return codePoint == ' ';
    }

    @Override
    public String toString() {
        return String.format("'%s'=%.1f", getCharacter(), widthFontUnits);
    }
}
