package com.abcft.pdfedit.core.model;

import com.google.common.base.MoreObjects;

/**
 * Translation, rotation, scale and skew parts of a {@link TransformMatrix}.
 *
 * Angles are in degrees.
 */
public final class MatrixDecomposition {

    public final double translateX;
    public final double translateY;
    public final double rotation;
    public final double scaleX;
    public final double scaleY;
    public final double skewX;
    public final double skewY;

    public MatrixDecomposition(double translateX, double translateY, double rotation,
                               double scaleX, double scaleY, double skewX, double skewY) {
        this.translateX = translateX;
        this.translateY = translateY;
        this.rotation = rotation;
        this.scaleX = scaleX;
        this.scaleY = scaleY;
        this.skewX = skewX;
        this.skewY = skewY;
    }

    /**
     * Rebuilds a matrix applying scale, skew, rotation and translation in that order.
     */
    public TransformMatrix recompose() {
        return TransformMatrix.scaling(scaleX, scaleY)
                .multiply(TransformMatrix.skew(skewX, skewY))
                .multiply(TransformMatrix.rotation(rotation))
                .multiply(TransformMatrix.translation(translateX, translateY));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("translateX", translateX)
                .add("translateY", translateY)
                .add("rotation", rotation)
                .add("scaleX", scaleX)
                .add("scaleY", scaleY)
                .add("skewX", skewX)
                .add("skewY", skewY)
                .toString();
    }
}
