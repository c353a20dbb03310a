package com.abcft.pdfedit.core.model;

import com.abcft.pdfedit.core.util.FloatUtils;
import org.apache.commons.math3.util.FastMath;
import org.apache.pdfbox.util.Matrix;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.util.Arrays;
import java.util.Optional;

/**
 * Immutable 2D affine matrix in PDF notation.
 *
 * <pre>
 * | a b 0 |
 * | c d 0 |
 * | e f 1 |
 * </pre>
 *
 * Points are row vectors: {@code [x y 1] × M}. Every operation returns a new instance.
 */
public final class TransformMatrix {

    /**
     * Determinant magnitude under which a matrix is treated as singular.
     */
    public static final double SINGULAR_EPSILON = 1e-10;

    private static final TransformMatrix IDENTITY = new TransformMatrix(1, 0, 0, 1, 0, 0);

    private final double a;
    private final double b;
    private final double c;
    private final double d;
    private final double e;
    private final double f;

    private TransformMatrix(double a, double b, double c, double d, double e, double f) {
        this.a = a;
        this.b = b;
        this.c = c;
        this.d = d;
        this.e = e;
        this.f = f;
    }

    // ---- factories ----

    public static TransformMatrix identity() {
        return IDENTITY;
    }

    public static TransformMatrix of(double a, double b, double c, double d, double e, double f) {
        return new TransformMatrix(a, b, c, d, e, f);
    }

    public static TransformMatrix fromArray(float[] values) {
        if (values == null || values.length != 6) {
            throw new IllegalArgumentException("Matrix needs exactly 6 values");
        }
        return new TransformMatrix(values[0], values[1], values[2], values[3], values[4], values[5]);
    }

    public static TransformMatrix fromAffineTransform(AffineTransform at) {
        return new TransformMatrix(at.getScaleX(), at.getShearY(), at.getShearX(), at.getScaleY(),
                at.getTranslateX(), at.getTranslateY());
    }

    public static TransformMatrix fromPdfMatrix(Matrix matrix) {
        return new TransformMatrix(matrix.getValue(0, 0), matrix.getValue(0, 1),
                matrix.getValue(1, 0), matrix.getValue(1, 1),
                matrix.getValue(2, 0), matrix.getValue(2, 1));
    }

    public static TransformMatrix translation(double tx, double ty) {
        return new TransformMatrix(1, 0, 0, 1, tx, ty);
    }

    public static TransformMatrix scaling(double s) {
        return scaling(s, s);
    }

    public static TransformMatrix scaling(double sx, double sy) {
        return new TransformMatrix(sx, 0, 0, sy, 0, 0);
    }

    /**
     * Counter-clockwise rotation around the origin.
     *
     * @param degrees the angle in degrees.
     */
    public static TransformMatrix rotation(double degrees) {
        double rad = FastMath.toRadians(degrees);
        double cos = FastMath.cos(rad);
        double sin = FastMath.sin(rad);
        return new TransformMatrix(cos, sin, -sin, cos, 0, 0);
    }

    /**
     * Counter-clockwise rotation around the pivot {@code (cx, cy)}.
     */
    public static TransformMatrix rotation(double degrees, double cx, double cy) {
        return translation(-cx, -cy)
                .multiply(rotation(degrees))
                .multiply(translation(cx, cy));
    }

    public static TransformMatrix skew(double xDegrees, double yDegrees) {
        return new TransformMatrix(1, FastMath.tan(FastMath.toRadians(yDegrees)),
                FastMath.tan(FastMath.toRadians(xDegrees)), 1, 0, 0);
    }

    /**
     * Builds a text matrix for text drawn at {@code (x, y)}.
     *
     * @param fontSize font size, applied as uniform scale.
     * @param horizontalScale horizontal scale in percent (100 is neutral).
     */
    public static TransformMatrix createTextMatrix(double fontSize, double x, double y,
                                                   double rotationDegrees, double horizontalScale) {
        return scaling(fontSize * horizontalScale / 100.0, fontSize)
                .multiply(rotation(rotationDegrees))
                .multiply(translation(x, y));
    }

    /**
     * Multiplies the matrices left to right; the first one is applied first.
     */
    public static TransformMatrix compose(TransformMatrix... matrices) {
        TransformMatrix result = IDENTITY;
        for (TransformMatrix matrix : matrices) {
            result = result.multiply(matrix);
        }
        return result;
    }

    /**
     * Component-wise linear interpolation, {@code t} clamped to [0, 1].
     */
    public static TransformMatrix interpolate(TransformMatrix m1, TransformMatrix m2, double t) {
        double k = FloatUtils.clamp(t, 0, 1);
        return new TransformMatrix(
                m1.a + (m2.a - m1.a) * k,
                m1.b + (m2.b - m1.b) * k,
                m1.c + (m2.c - m1.c) * k,
                m1.d + (m2.d - m1.d) * k,
                m1.e + (m2.e - m1.e) * k,
                m1.f + (m2.f - m1.f) * k);
    }

    // ---- algebra ----

    /**
     * Matrix product {@code this × other}: a point is mapped by {@code this} first,
     * then by {@code other}. {@code tm.multiply(ctm)} gives the text rendering matrix.
     */
    public TransformMatrix multiply(TransformMatrix other) {
        return new TransformMatrix(
                a * other.a + b * other.c,
                a * other.b + b * other.d,
                c * other.a + d * other.c,
                c * other.b + d * other.d,
                e * other.a + f * other.c + other.e,
                e * other.b + f * other.d + other.f);
    }

    /**
     * Pre-multiplies {@code other}, the way the {@code cm} operator updates the CTM.
     */
    public TransformMatrix concat(TransformMatrix other) {
        return other.multiply(this);
    }

    public double determinant() {
        return a * d - b * c;
    }

    public boolean isInvertible() {
        return FastMath.abs(determinant()) > SINGULAR_EPSILON;
    }

    /**
     * @return the inverse matrix, or empty if the matrix is (nearly) singular.
     */
    public Optional<TransformMatrix> inverse() {
        double det = determinant();
        if (FastMath.abs(det) <= SINGULAR_EPSILON) {
            return Optional.empty();
        }
        double ia = d / det;
        double ib = -b / det;
        double ic = -c / det;
        double id = a / det;
        double ie = -(e * ia + f * ic);
        double iff = -(e * ib + f * id);
        return Optional.of(new TransformMatrix(ia, ib, ic, id, ie, iff));
    }

    // ---- mapping ----

    public Point2D transformPoint(double x, double y) {
        return new Point2D.Double(a * x + c * y + e, b * x + d * y + f);
    }

    public Point2D transformPoint(Point2D point) {
        return transformPoint(point.getX(), point.getY());
    }

    public Point2D transformDistance(double dx, double dy) {
        return new Point2D.Double(a * dx + c * dy, b * dx + d * dy);
    }

    /**
     * Maps the four corners of a box and returns their axis aligned bounds.
     */
    public Rectangle2D transformBBox(double x0, double y0, double x1, double y1) {
        double[][] corners = { {x0, y0}, {x1, y0}, {x1, y1}, {x0, y1} };
        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;
        for (double[] corner : corners) {
            Point2D p = transformPoint(corner[0], corner[1]);
            minX = FastMath.min(minX, p.getX());
            minY = FastMath.min(minY, p.getY());
            maxX = FastMath.max(maxX, p.getX());
            maxY = FastMath.max(maxY, p.getY());
        }
        return new Rectangle2D.Double(minX, minY, maxX - minX, maxY - minY);
    }

    public Rectangle2D transformBBox(Rectangle2D box) {
        return transformBBox(box.getMinX(), box.getMinY(), box.getMaxX(), box.getMaxY());
    }

    // ---- derived values ----

    public double getScaleX() {
        return FastMath.sqrt(a * a + b * b);
    }

    public double getScaleY() {
        return FastMath.sqrt(c * c + d * d);
    }

    /**
     * @return the rotation angle in degrees.
     */
    public double getRotation() {
        return FastMath.toDegrees(FastMath.atan2(b, a));
    }

    public Point2D getTranslation() {
        return new Point2D.Double(e, f);
    }

    public boolean isIdentity() {
        return isClose(IDENTITY);
    }

    public boolean hasRotation() {
        return FastMath.abs(b) > FloatUtils.EPSILON || FastMath.abs(c) > FloatUtils.EPSILON;
    }

    public boolean hasScale() {
        return FastMath.abs(getScaleX() - 1) > FloatUtils.EPSILON
                || FastMath.abs(getScaleY() - 1) > FloatUtils.EPSILON;
    }

    public boolean hasSkew() {
        return hasRotation() && FastMath.abs(b + c) > FloatUtils.EPSILON;
    }

    public TransformType classify() {
        if (isIdentity()) {
            return TransformType.IDENTITY;
        }
        boolean rotation = hasRotation();
        boolean scale = hasScale();
        if (!rotation && !scale) {
            return TransformType.TRANSLATION;
        }
        if (hasSkew()) {
            return TransformType.SKEW;
        }
        if (rotation && !scale) {
            return TransformType.ROTATION;
        }
        if (scale && !rotation) {
            return TransformType.SCALE;
        }
        if (scale) {
            return TransformType.SCALE_ROTATION;
        }
        return TransformType.GENERAL;
    }

    /**
     * Splits the matrix into translation, rotation, scale and skew.
     *
     * <p>The skew term assumes the axes are close to orthogonal; for matrices with real
     * shear the split is best-effort and {@link MatrixDecomposition#recompose()} may not
     * reproduce the input.</p>
     */
    public MatrixDecomposition decompose() {
        double sx = getScaleX();
        double sy = getScaleY();
        if (determinant() < 0) {
            sx = -sx;
        }
        double rad = FastMath.atan2(b, a);
        double skewX = 0;
        if (sy > FloatUtils.EPSILON) {
            skewX = FastMath.toDegrees(FastMath.atan2(c / sy + FastMath.sin(rad), FastMath.cos(rad)));
        }
        return new MatrixDecomposition(e, f, FastMath.toDegrees(rad), sx, sy, skewX, 0);
    }

    public boolean isClose(TransformMatrix other) {
        return isClose(other, FloatUtils.EPSILON);
    }

    public boolean isClose(TransformMatrix other, double tolerance) {
        return FloatUtils.feq(a, other.a, tolerance) && FloatUtils.feq(b, other.b, tolerance)
                && FloatUtils.feq(c, other.c, tolerance) && FloatUtils.feq(d, other.d, tolerance)
                && FloatUtils.feq(e, other.e, tolerance) && FloatUtils.feq(f, other.f, tolerance);
    }

    // ---- conversions ----

    public double[] toArray() {
        return new double[] { a, b, c, d, e, f };
    }

    public AffineTransform toAffineTransform() {
        return new AffineTransform(a, b, c, d, e, f);
    }

    public Matrix toPdfMatrix() {
        return new Matrix((float) a, (float) b, (float) c, (float) d, (float) e, (float) f);
    }

    public double getA() {
        return a;
    }

    public double getB() {
        return b;
    }

    public double getC() {
        return c;
    }

    public double getD() {
        return d;
    }

    public double getE() {
        return e;
    }

    public double getF() {
        return f;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TransformMatrix)) {
            return false;
        }
        return Arrays.equals(toArray(), ((TransformMatrix) o).toArray());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(toArray());
    }

    @Override
    public String toString() {
        return String.format("[%.4f %.4f %.4f %.4f %.4f %.4f]", a, b, c, d, e, f);
    }
}
