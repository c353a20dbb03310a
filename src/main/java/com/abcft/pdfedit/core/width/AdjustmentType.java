package com.abcft.pdfedit.core.width;

public enum AdjustmentType {
    NONE,
    TRACKING,
    KERNING,
    WORD_SPACING,
    HORIZONTAL_SCALE,
    COMBINED
}
