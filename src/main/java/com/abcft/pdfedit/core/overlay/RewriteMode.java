package com.abcft.pdfedit.core.overlay;

/**
 * Where the replacement text is placed within the original box.
 */
public enum RewriteMode {
    PRESERVE_POSITION,
    PRESERVE_BASELINE,
    ADJUST_TO_FIT,
    CENTER_IN_BBOX
}
