package com.abcft.pdfedit.core.overlay;

import com.abcft.pdfedit.core.model.Rectangle;
import com.google.common.base.MoreObjects;

import java.awt.Color;
import java.awt.geom.Point2D;

/**
 * One drawable piece of an overlay. Coordinates are page coordinates with the origin at the top-left.
 *
 * <p>The id is shared with the layer registered in the {@link com.abcft.pdfedit.core.zorder.ZOrderManager}.</p>
 */
public class OverlayLayer {

    public static final String DEFAULT_FONT_NAME = "Helvetica";
    public static final float DEFAULT_FONT_SIZE = 12;

    private final String id;
    private final OverlayType type;
    private final int zOrder;
    private final int page;
    private final Rectangle bbox;
    private final long createdAt;

    private Point2D origin;
    private String content;
    private String fontName = DEFAULT_FONT_NAME;
    private float fontSize = DEFAULT_FONT_SIZE;
    private Color color = Color.BLACK;
    private Color fillColor;
    private float fillOpacity = 1.0f;
    private Color strokeColor;
    private float strokeWidth;
    private float charSpacing;
    private float wordSpacing;
    private float horizontalScale = 100;
    private String sourceSpanId;

    OverlayLayer(String id, OverlayType type, int page, int zOrder, Rectangle bbox) {
        this.id = id;
        this.type = type;
        this.page = page;
        this.zOrder = zOrder;
        this.bbox = new Rectangle(bbox);
        this.createdAt = System.currentTimeMillis();
    }

    public String getId() {
        return id;
    }

    public OverlayType getType() {
        return type;
    }

    /**
     * The z-order assigned when the layer was registered.
     */
    public int getZOrder() {
        return zOrder;
    }

    public int getPage() {
        return page;
    }

    public Rectangle getBBox() {
        return new Rectangle(bbox);
    }

    public long getCreatedAt() {
        return createdAt;
    }

    /**
     * Start of the text baseline, {@code null} for non-text layers.
     */
    public Point2D getOrigin() {
        return origin == null ? null : (Point2D) origin.clone();
    }

    OverlayLayer setOrigin(Point2D origin) {
        this.origin = origin == null ? null : new Point2D.Double(origin.getX(), origin.getY());
        return this;
    }

    public String getContent() {
        return content;
    }

    OverlayLayer setContent(String content) {
        this.content = content;
        return this;
    }

    public String getFontName() {
        return fontName;
    }

    OverlayLayer setFontName(String fontName) {
        this.fontName = fontName != null ? fontName : DEFAULT_FONT_NAME;
        return this;
    }

    public float getFontSize() {
        return fontSize;
    }

    OverlayLayer setFontSize(float fontSize) {
        this.fontSize = fontSize;
        return this;
    }

    public Color getColor() {
        return color;
    }

    OverlayLayer setColor(Color color) {
        this.color = color != null ? color : Color.BLACK;
        return this;
    }

    public Color getFillColor() {
        return fillColor;
    }

    OverlayLayer setFillColor(Color fillColor) {
        this.fillColor = fillColor;
        return this;
    }

    public float getFillOpacity() {
        return fillOpacity;
    }

    OverlayLayer setFillOpacity(float fillOpacity) {
        this.fillOpacity = fillOpacity;
        return this;
    }

    public Color getStrokeColor() {
        return strokeColor;
    }

    OverlayLayer setStrokeColor(Color strokeColor) {
        this.strokeColor = strokeColor;
        return this;
    }

    public float getStrokeWidth() {
        return strokeWidth;
    }

    OverlayLayer setStrokeWidth(float strokeWidth) {
        this.strokeWidth = strokeWidth;
        return this;
    }

    /**
     * Tc in unscaled text space units.
     */
    public float getCharSpacing() {
        return charSpacing;
    }

    OverlayLayer setCharSpacing(float charSpacing) {
        this.charSpacing = charSpacing;
        return this;
    }

    public float getWordSpacing() {
        return wordSpacing;
    }

    OverlayLayer setWordSpacing(float wordSpacing) {
        this.wordSpacing = wordSpacing;
        return this;
    }

    /**
     * Tz in percent.
     */
    public float getHorizontalScale() {
        return horizontalScale;
    }

    OverlayLayer setHorizontalScale(float horizontalScale) {
        this.horizontalScale = horizontalScale;
        return this;
    }

    public String getSourceSpanId() {
        return sourceSpanId;
    }

    OverlayLayer setSourceSpanId(String sourceSpanId) {
        this.sourceSpanId = sourceSpanId;
        return this;
    }

    public boolean hasFill() {
        return fillColor != null && fillOpacity > 0;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("type", type)
                .add("page", page)
                .add("z", zOrder)
                .add("bbox", bbox)
                .omitNullValues()
                .add("content", content)
                .toString();
    }
}
