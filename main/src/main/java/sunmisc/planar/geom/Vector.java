package sunmisc.planar.geom;

import org.jetbrains.annotations.NotNull;

/**
 * Immutable two-dimensional vector of {@code float} components.
 * <p>
 * No operation ever throws on floating-point edge cases: division by zero,
 * normalizing the zero vector and reciprocals of zero components follow
 * IEEE 754 and produce infinite or NaN components.
 * <p>
 * Equality is tolerance based, see {@link #equals(Object)}.
 */
public final class Vector {

    /**
     * Per-component tolerance of {@link #equals(Object)}
     */
    public static final float TOLERANCE = 1e-6f;

    private static final Vector ZERO = new Vector(0f, 0f);
    private static final Vector X_AXIS = new Vector(1f, 0f);
    private static final Vector Y_AXIS = new Vector(0f, 1f);
    private static final Vector ONE = new Vector(1f, 1f);

    private final float x, y;

    private Vector(final float x, final float y) {
        this.x = x;
        this.y = y;
    }

    public static Vector zero() {
        return ZERO;
    }

    public static Vector xAxis() {
        return X_AXIS;
    }

    public static Vector yAxis() {
        return Y_AXIS;
    }

    public static Vector one() {
        return ONE;
    }

    public static Vector of(final float x, final float y) {
        return new Vector(x, y);
    }

    public static Vector of(final int x, final int y) {
        return new Vector(x, y);
    }

    public float x() {
        return this.x;
    }

    public float y() {
        return this.y;
    }

    /**
     * Squared length, cheaper than {@link #length()} when only
     * magnitudes are compared.
     */
    public float lengthSquared() {
        return this.x * this.x + this.y * this.y;
    }

    public float length() {
        return (float) Math.sqrt(lengthSquared());
    }

    public float dot(@NotNull final Vector other) {
        return this.x * other.x + this.y * other.y;
    }

    /**
     * Scalar cross product, positive when {@code other} lies
     * counter-clockwise of this vector
     */
    public float cross(@NotNull final Vector other) {
        return this.x * other.y - this.y * other.x;
    }

    public Vector xComponent() {
        return new Vector(this.x, 0f);
    }

    public Vector yComponent() {
        return new Vector(0f, this.y);
    }

    public Vector reciprocal() {
        return new Vector(1f / this.x, 1f / this.y);
    }

    /**
     * Component-wise (Hadamard) product
     */
    public Vector times(@NotNull final Vector other) {
        return new Vector(this.x * other.x, this.y * other.y);
    }

    /**
     * Unit vector of the same direction; NaN components for a zero vector.
     */
    public Vector normalized() {
        return divide(length());
    }

    /**
     * Clamps each component into {@code [min, max]} of the same axis.
     * If a lower bound exceeds its upper bound the upper bound wins.
     * A NaN component or a NaN bound yields a NaN component.
     */
    public Vector clamp(@NotNull final Vector min, @NotNull final Vector max) {
        return new Vector(
                Math.min(max.x, Math.max(min.x, this.x)),
                Math.min(max.y, Math.max(min.y, this.y))
        );
    }

    public Vector negate() {
        return new Vector(-this.x, -this.y);
    }

    public Vector add(@NotNull final Vector other) {
        return new Vector(this.x + other.x, this.y + other.y);
    }

    public Vector sub(@NotNull final Vector other) {
        return add(other.negate());
    }

    public Vector multiply(final float scalar) {
        return new Vector(this.x * scalar, this.y * scalar);
    }

    public Vector multiply(final int scalar) {
        return multiply((float) scalar);
    }

    public Vector divide(final float scalar) {
        return new Vector(this.x / scalar, this.y / scalar);
    }

    public Vector divide(final int scalar) {
        return divide((float) scalar);
    }

    /**
     * Two vectors are equal when each pair of components differs by
     * strictly less than {@link #TOLERANCE}. The relation is not
     * transitive near the tolerance boundary.
     */
    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof Vector other)) return false;
        return Math.abs(this.x - other.x) < TOLERANCE
                && Math.abs(this.y - other.y) < TOLERANCE;
    }

    // tolerance equality has no consistent bucketing
    @Override
    public int hashCode() {
        return 0;
    }

    @Override
    public String toString() {
        return String.format("<%s, %s>", this.x, this.y);
    }
}
