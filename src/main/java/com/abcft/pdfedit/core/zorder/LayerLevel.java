package com.abcft.pdfedit.core.zorder;

import org.apache.commons.lang3.StringUtils;

/**
 * Stacking bands; every layer lives in one band and starts at its base z-order.
 */
public enum LayerLevel {
    BACKGROUND(0),
    REDACTION(100),
    CONTENT_BASE(200),
    FILL(300),
    STROKE(350),
    TEXT_BACKGROUND(380),
    TEXT(400),
    TEXT_DECORATION(450),
    HIGHLIGHT(500),
    ANNOTATION(600),
    MARKUP(700),
    FOREGROUND(800),
    OVERLAY(900),
    UI(1000);

    private final int base;

    LayerLevel(int base) {
        this.base = base;
    }

    public int getBase() {
        return base;
    }

    /**
     * The base of the next level; the top level has no limit.
     */
    public int getLimit() {
        LayerLevel[] levels = values();
        return ordinal() < levels.length - 1 ? levels[ordinal() + 1].base : Integer.MAX_VALUE;
    }

    /**
     * The highest level whose base does not exceed {@code zOrder}.
     */
    public static LayerLevel fromZOrder(int zOrder) {
        LayerLevel result = BACKGROUND;
        for (LayerLevel level : values()) {
            if (level.base <= zOrder) {
                result = level;
            }
        }
        return result;
    }

    /**
     * Maps a free-form source type ("highlight", "redaction", ...) to a level; unknown types are text.
     */
    public static LayerLevel forSourceType(String sourceType) {
        switch (StringUtils.lowerCase(StringUtils.defaultString(sourceType))) {
            case "background":
                return BACKGROUND;
            case "redaction":
            case "erase":
                return REDACTION;
            case "fill":
                return FILL;
            case "text_background":
                return TEXT_BACKGROUND;
            case "text":
            case "overlay":
                return TEXT;
            case "underline":
            case "strikethrough":
                return TEXT_DECORATION;
            case "highlight":
                return HIGHLIGHT;
            case "annotation":
            case "note":
            case "comment":
                return ANNOTATION;
            case "markup":
                return MARKUP;
            case "selection":
            case "cursor":
                return UI;
            default:
                return TEXT;
        }
    }
}
