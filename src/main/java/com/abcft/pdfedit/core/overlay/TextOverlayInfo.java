package com.abcft.pdfedit.core.overlay;

import com.abcft.pdfedit.core.model.Rectangle;
import com.abcft.pdfedit.core.validation.ModificationRecord;
import com.abcft.pdfedit.core.width.FitAnalysis;
import com.google.common.collect.ImmutableList;

import java.awt.Color;
import java.awt.geom.Point2D;
import java.util.List;

/**
 * A prepared text replacement: what is replaced, with what, and the layers that draw it.
 */
public class TextOverlayInfo {

    private final String id;
    private final int page;
    private final OverlayStrategy strategy;
    private final RewriteMode mode;

    private final String originalText;
    private final Rectangle originalBBox;
    private final String originalFont;
    private final float originalFontSize;
    private final String originalSpanId;

    private final String newText;
    private final String newFont;
    private final float newFontSize;
    private final Color newColor;

    private final float charSpacingDelta;
    private final float scaleFactor;
    private final Point2D positionOffset;

    private final ImmutableList<OverlayLayer> layers;
    private final FitAnalysis fitAnalysis;
    private final long createdAt;

    private OverlayState state = OverlayState.PREPARED;
    private long appliedAt;

    TextOverlayInfo(String id, RewriteRequest request, OverlayStrategy strategy, RewriteMode mode,
                    float charSpacingDelta, float scaleFactor, List<OverlayLayer> layers,
                    FitAnalysis fitAnalysis) {
        this.id = id;
        this.page = request.page;
        this.strategy = strategy;
        this.mode = mode;
        this.originalText = request.originalText;
        this.originalBBox = new Rectangle(request.originalBBox);
        this.originalFont = request.originalFont;
        this.originalFontSize = request.originalFontSize;
        this.originalSpanId = request.spanId;
        this.newText = request.newText;
        this.newFont = request.fontName;
        this.newFontSize = request.fontSize;
        this.newColor = request.color;
        this.charSpacingDelta = charSpacingDelta;
        this.scaleFactor = scaleFactor;
        this.positionOffset = new Point2D.Double(request.offsetX, request.offsetY);
        this.layers = ImmutableList.copyOf(layers);
        this.fitAnalysis = fitAnalysis;
        this.createdAt = System.currentTimeMillis();
    }

    public String getId() {
        return id;
    }

    public int getPage() {
        return page;
    }

    public OverlayStrategy getStrategy() {
        return strategy;
    }

    public RewriteMode getMode() {
        return mode;
    }

    public String getOriginalText() {
        return originalText;
    }

    public Rectangle getOriginalBBox() {
        return new Rectangle(originalBBox);
    }

    public String getOriginalFont() {
        return originalFont;
    }

    public float getOriginalFontSize() {
        return originalFontSize;
    }

    public String getOriginalSpanId() {
        return originalSpanId;
    }

    public String getNewText() {
        return newText;
    }

    /**
     * The text actually drawn. Differs from {@link #getNewText()} when fitting truncated it.
     */
    public String getFinalText() {
        return fitAnalysis != null ? fitAnalysis.getFinalText() : newText;
    }

    public String getNewFont() {
        return newFont;
    }

    public float getNewFontSize() {
        return newFontSize;
    }

    public Color getNewColor() {
        return newColor;
    }

    public float getCharSpacingDelta() {
        return charSpacingDelta;
    }

    public float getScaleFactor() {
        return scaleFactor;
    }

    public Point2D getPositionOffset() {
        return (Point2D) positionOffset.clone();
    }

    /**
     * Layers in the order they were registered.
     */
    public List<OverlayLayer> getLayers() {
        return layers;
    }

    public FitAnalysis getFitAnalysis() {
        return fitAnalysis;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getAppliedAt() {
        return appliedAt;
    }

    public OverlayState getState() {
        return state;
    }

    void transitionTo(OverlayState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(String.format("Overlay %s: %s -> %s", id, state, next));
        }
        if (next == OverlayState.APPLIED) {
            appliedAt = System.currentTimeMillis();
        }
        state = next;
    }

    public boolean isApplied() {
        return state == OverlayState.APPLIED || state == OverlayState.COMMITTED;
    }

    public boolean isCommitted() {
        return state == OverlayState.COMMITTED;
    }

    /**
     * Drawn on the page but not yet committed.
     */
    public boolean isPendingWrite() {
        return state == OverlayState.APPLIED;
    }

    public ModificationRecord toModificationRecord() {
        return new ModificationRecord("text_rewrite", page, originalText, getFinalText());
    }

    @Override
    public String toString() {
        return String.format("Overlay %s[page=%d, %s, %s, \"%s\" -> \"%s\"]",
                id, page + 1, strategy, state, originalText, getFinalText());
    }
}
