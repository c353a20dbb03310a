package com.abcft.pdfedit.core.model;

/**
 * Coarse classification of an affine matrix.
 */
public enum TransformType {
    IDENTITY,
    TRANSLATION,
    SCALE,
    ROTATION,
    SCALE_ROTATION,
    SKEW,
    GENERAL
}
