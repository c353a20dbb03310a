package com.abcft.pdfedit.core.model;

import com.abcft.pdfedit.core.util.FloatUtils;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.util.List;

/**
 * An axis aligned box described by its edges (x0, y0, x1, y1).
 *
 * <p>Boxes handed to the overlay and z-order code are in top-left page space, so {@code y0}
 * is the top edge and {@code y1} the bottom edge.</p>
 */
@SuppressWarnings("serial")
public class Rectangle extends Rectangle2D.Float {

    public static final float EDGE_TOLERANCE = 0.5f;

    /**
     * @param rectangles
     * @return minimum bounding box that contains all the rectangles
     */
    public static Rectangle boundingBoxOf(List<? extends Rectangle2D> rectangles) {
        float minx = java.lang.Float.MAX_VALUE;
        float miny = java.lang.Float.MAX_VALUE;
        float maxx = -java.lang.Float.MAX_VALUE;
        float maxy = -java.lang.Float.MAX_VALUE;

        for (Rectangle2D r : rectangles) {
            minx = (float) Math.min(r.getMinX(), minx);
            miny = (float) Math.min(r.getMinY(), miny);
            maxx = (float) Math.max(r.getMaxX(), maxx);
            maxy = (float) Math.max(r.getMaxY(), maxy);
        }
        if (minx > maxx) {
            return new Rectangle();
        }
        return new Rectangle(minx, miny, maxx - minx, maxy - miny);
    }

    public static Rectangle fromLTRB(double left, double top, double right, double bottom) {
        return new Rectangle(Math.min(left, right), Math.min(top, bottom),
                Math.abs(right - left), Math.abs(bottom - top));
    }

    public Rectangle() {
    }

    public Rectangle(Rectangle2D rect) {
        super((float)rect.getX(), (float)rect.getY(), (float)rect.getWidth(), (float)rect.getHeight());
    }

    public Rectangle(double left, double top, double width, double height) {
        super((float) left, (float) top, (float) width, (float) height);
    }

    @Override
    public String toString() {
        return String.format("%s[l=%.2f,t=%.2f,r=%.2f,b=%.2f]", getClass().getSimpleName(),
                this.getLeft(), this.getTop(), this.getRight(), this.getBottom());
    }

    public static boolean nearlyEquals(Rectangle2D one, Rectangle2D other, double epsilon) {
        return FloatUtils.feq(one.getMinX(), other.getMinX(), epsilon) &&
                FloatUtils.feq(one.getMinY(), other.getMinY(), epsilon) &&
                FloatUtils.feq(one.getMaxX(), other.getMaxX(), epsilon) &&
                FloatUtils.feq(one.getMaxY(), other.getMaxY(), epsilon);
    }

    public boolean nearlyEquals(Rectangle2D other) {
        return nearlyEquals(this, other, EDGE_TOLERANCE);
    }

    public static boolean nearlyContains(Rectangle2D one, double x, double y, double epsilon) {
        return x >= one.getMinX() - epsilon && x <= one.getMaxX() + epsilon
                && y >= one.getMinY() - epsilon && y <= one.getMaxY() + epsilon;
    }

    public float getArea() {
        return width * height;
    }

    public float getTop() {
        return (float) this.getMinY();
    }

    public float getRight() {
        return (float) this.getMaxX();
    }

    public float getLeft() {
        return (float) this.getMinX();
    }

    public float getBottom() {
        return (float) this.getMaxY();
    }

    public Point2D getCenter() {
        return new Point2D.Float((float) getCenterX(), (float) getCenterY());
    }

    /**
     * Returns a copy grown by {@code margin} on every side.
     */
    public Rectangle expandedBy(double margin) {
        return fromLTRB(getLeft() - margin, getTop() - margin, getRight() + margin, getBottom() + margin);
    }

    /**
     * Edges of the intersection of two boxes, as {x0, y0, x1, y1}. The result may be
     * inverted (x0 &gt; x1 or y0 &gt; y1) when the boxes do not overlap.
     */
    public static double[] intersectionEdges(Rectangle2D one, Rectangle2D other) {
        return new double[] {
                Math.max(one.getMinX(), other.getMinX()),
                Math.max(one.getMinY(), other.getMinY()),
                Math.min(one.getMaxX(), other.getMaxX()),
                Math.min(one.getMaxY(), other.getMaxY())
        };
    }

    public float[] toEdges() {
        return new float[] { getLeft(), getTop(), getRight(), getBottom() };
    }

}
