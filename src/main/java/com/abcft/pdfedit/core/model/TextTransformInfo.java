package com.abcft.pdfedit.core.model;

import org.apache.commons.math3.util.FastMath;

/**
 * How text drawn under a given CTM and text matrix ends up on the page.
 */
public final class TextTransformInfo {

    private static final double ROTATION_THRESHOLD = 0.5;
    private static final double NON_UNIFORM_THRESHOLD = 0.01;

    private final TransformMatrix ctm;
    private final TransformMatrix textMatrix;
    private final TransformMatrix combined;
    private final double fontSize;
    private final double horizontalScale;

    public TextTransformInfo(TransformMatrix ctm, TransformMatrix textMatrix, double fontSize, double horizontalScale) {
        this.ctm = ctm;
        this.textMatrix = textMatrix;
        this.combined = textMatrix.multiply(ctm);
        this.fontSize = fontSize;
        this.horizontalScale = horizontalScale;
    }

    public TransformMatrix getCtm() {
        return ctm;
    }

    public TransformMatrix getTextMatrix() {
        return textMatrix;
    }

    public TransformMatrix getCombined() {
        return combined;
    }

    /**
     * Font size in page units once the text and page matrices are applied.
     */
    public double getEffectiveFontSize() {
        return fontSize * combined.getScaleY();
    }

    /**
     * Horizontal stretch relative to the vertical size (1.0 is undistorted).
     */
    public double getEffectiveHorizontalScale() {
        double sy = combined.getScaleY();
        if (sy <= 0) {
            return horizontalScale / 100.0;
        }
        return horizontalScale / 100.0 * combined.getScaleX() / sy;
    }

    public double getRotation() {
        return combined.getRotation();
    }

    public boolean isRotated() {
        return FastMath.abs(getRotation()) > ROTATION_THRESHOLD;
    }

    public boolean isScaled() {
        return FastMath.abs(combined.getScaleX() - combined.getScaleY()) > NON_UNIFORM_THRESHOLD;
    }

    public boolean isMirrored() {
        return combined.determinant() < 0;
    }

    /**
     * Page-space advance of a glyph.
     *
     * @param widthFontUnits glyph width in 1/1000 em.
     */
    public double getGlyphWidth(double widthFontUnits) {
        return widthFontUnits / 1000.0 * getEffectiveFontSize() * getEffectiveHorizontalScale();
    }

    @Override
    public String toString() {
        return String.format("TextTransformInfo[size=%.2f, hscale=%.2f, rotation=%.2f, mirrored=%s]",
                getEffectiveFontSize(), getEffectiveHorizontalScale(), getRotation(), isMirrored());
    }
}
