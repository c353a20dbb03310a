package com.abcft.pdfedit.core.overlay;

import com.abcft.pdfedit.core.model.Rectangle;
import com.google.common.base.Preconditions;

import java.awt.Color;
import java.awt.geom.Rectangle2D;

/**
 * What to replace and how. Strategy and mode fall back to the rewriter's parameters when unset.
 */
public final class RewriteRequest {

    public static final class Builder {

        private final int page;
        private final String originalText;
        private final Rectangle originalBBox;
        private final String newText;
        private String fontName = OverlayLayer.DEFAULT_FONT_NAME;
        private float fontSize = OverlayLayer.DEFAULT_FONT_SIZE;
        private Color color = Color.BLACK;
        private OverlayStrategy strategy;
        private RewriteMode mode;
        private String originalFont;
        private float originalFontSize;
        private String spanId;
        private float offsetX;
        private float offsetY;

        /**
         * @param page the page index (0-based).
         * @param originalText the text being replaced.
         * @param originalBBox box of the original text, top-left page coordinates.
         * @param newText the replacement.
         */
        public Builder(int page, String originalText, Rectangle2D originalBBox, String newText) {
            Preconditions.checkNotNull(originalBBox, "originalBBox");
            Preconditions.checkNotNull(newText, "newText");
            this.page = page;
            this.originalText = originalText != null ? originalText : "";
            this.originalBBox = new Rectangle(originalBBox);
            this.newText = newText;
        }

        public Builder setFont(String fontName, float fontSize) {
            this.fontName = fontName != null ? fontName : OverlayLayer.DEFAULT_FONT_NAME;
            this.fontSize = fontSize;
            return this;
        }

        public Builder setColor(Color color) {
            this.color = color != null ? color : Color.BLACK;
            return this;
        }

        public Builder setStrategy(OverlayStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder setMode(RewriteMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder setOriginalFont(String originalFont, float originalFontSize) {
            this.originalFont = originalFont;
            this.originalFontSize = originalFontSize;
            return this;
        }

        public Builder setSpanId(String spanId) {
            this.spanId = spanId;
            return this;
        }

        public Builder setPositionOffset(float offsetX, float offsetY) {
            this.offsetX = offsetX;
            this.offsetY = offsetY;
            return this;
        }

        public RewriteRequest build() {
            return new RewriteRequest(this);
        }
    }

    private RewriteRequest(Builder builder) {
        this.page = builder.page;
        this.originalText = builder.originalText;
        this.originalBBox = builder.originalBBox;
        this.newText = builder.newText;
        this.fontName = builder.fontName;
        this.fontSize = builder.fontSize;
        this.color = builder.color;
        this.strategy = builder.strategy;
        this.mode = builder.mode;
        this.originalFont = builder.originalFont;
        this.originalFontSize = builder.originalFontSize;
        this.spanId = builder.spanId;
        this.offsetX = builder.offsetX;
        this.offsetY = builder.offsetY;
    }

    final int page;
    final String originalText;
    final Rectangle originalBBox;
    final String newText;
    final String fontName;
    final float fontSize;
    final Color color;
    final OverlayStrategy strategy;
    final RewriteMode mode;
    final String originalFont;
    final float originalFontSize;
    final String spanId;
    final float offsetX;
    final float offsetY;

    public boolean isFontChanged() {
        return originalFont != null && !originalFont.equals(fontName);
    }
}
