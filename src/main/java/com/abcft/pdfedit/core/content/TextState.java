package com.abcft.pdfedit.core.content;

import com.abcft.pdfedit.core.model.TextTransformInfo;
import com.abcft.pdfedit.core.model.TransformMatrix;
import org.apache.commons.math3.util.FastMath;
import org.apache.pdfbox.pdmodel.font.PDFont;

/**
 * Text state parameters in effect while a content stream is interpreted.
 *
 * <p>Instances are mutable while parsing; every {@link TextShowOperation} carries its own {@link #copy()}.</p>
 */
public class TextState {

    public static final int RENDER_MODE_INVISIBLE = 3;

    private String fontResourceName;
    private String fontName;
    private PDFont font;
    private double fontSize;
    private double charSpacing;
    private double wordSpacing;
    private double horizontalScale = 100.0;
    private double leading;
    private int renderMode;
    private double rise;
    private TransformMatrix textMatrix = TransformMatrix.identity();
    private TransformMatrix textLineMatrix = TransformMatrix.identity();
    private TransformMatrix ctm = TransformMatrix.identity();

    public TextState() {
    }

    public TextState copy() {
        TextState copy = new TextState();
        copy.fontResourceName = fontResourceName;
        copy.fontName = fontName;
        copy.font = font;
        copy.fontSize = fontSize;
        copy.charSpacing = charSpacing;
        copy.wordSpacing = wordSpacing;
        copy.horizontalScale = horizontalScale;
        copy.leading = leading;
        copy.renderMode = renderMode;
        copy.rise = rise;
        copy.textMatrix = textMatrix;
        copy.textLineMatrix = textLineMatrix;
        copy.ctm = ctm;
        return copy;
    }

    /**
     * The name used with {@code Tf}, e.g. {@code F1}.
     */
    public String getFontResourceName() {
        return fontResourceName;
    }

    public void setFontResourceName(String fontResourceName) {
        this.fontResourceName = fontResourceName;
    }

    /**
     * The resolved font name, or the resource name if it could not be resolved.
     */
    public String getFontName() {
        return fontName;
    }

    public void setFontName(String fontName) {
        this.fontName = fontName;
    }

    /**
     * @return the PDFBox font, or {@code null} when the stream was parsed without page resources.
     */
    public PDFont getFont() {
        return font;
    }

    public void setFont(PDFont font) {
        this.font = font;
    }

    public double getFontSize() {
        return fontSize;
    }

    public void setFontSize(double fontSize) {
        this.fontSize = fontSize;
    }

    public double getCharSpacing() {
        return charSpacing;
    }

    public void setCharSpacing(double charSpacing) {
        this.charSpacing = charSpacing;
    }

    public double getWordSpacing() {
        return wordSpacing;
    }

    public void setWordSpacing(double wordSpacing) {
        this.wordSpacing = wordSpacing;
    }

    /**
     * Horizontal scaling in percent.
     */
    public double getHorizontalScale() {
        return horizontalScale;
    }

    public void setHorizontalScale(double horizontalScale) {
        this.horizontalScale = horizontalScale;
    }

    public double getLeading() {
        return leading;
    }

    public void setLeading(double leading) {
        this.leading = leading;
    }

    public int getRenderMode() {
        return renderMode;
    }

    public void setRenderMode(int renderMode) {
        this.renderMode = renderMode;
    }

    public double getRise() {
        return rise;
    }

    public void setRise(double rise) {
        this.rise = rise;
    }

    public TransformMatrix getTextMatrix() {
        return textMatrix;
    }

    public void setTextMatrix(TransformMatrix textMatrix) {
        this.textMatrix = textMatrix;
    }

    public TransformMatrix getTextLineMatrix() {
        return textLineMatrix;
    }

    public void setTextLineMatrix(TransformMatrix textLineMatrix) {
        this.textLineMatrix = textLineMatrix;
    }

    public TransformMatrix getCtm() {
        return ctm;
    }

    public void setCtm(TransformMatrix ctm) {
        this.ctm = ctm;
    }

    public boolean hasCharSpacing() {
        return FastMath.abs(charSpacing) > 0.001;
    }

    public boolean isSuperscript() {
        return rise > 0.5;
    }

    public boolean isSubscript() {
        return rise < -0.5;
    }

    public boolean isInvisible() {
        return renderMode == RENDER_MODE_INVISIBLE;
    }

    public TextTransformInfo transformInfo() {
        return new TextTransformInfo(ctm, textMatrix, fontSize, horizontalScale);
    }

    @Override
    public String toString() {
        return String.format("TextState[font=%s, size=%.2f, Tc=%.2f, Tw=%.2f, Tz=%.1f, Tm=%s]",
                fontName, fontSize, charSpacing, wordSpacing, horizontalScale, textMatrix);
    }
}
