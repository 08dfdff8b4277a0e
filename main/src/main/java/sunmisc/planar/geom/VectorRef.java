package sunmisc.planar.geom;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicReference;

import static java.util.Objects.requireNonNull;

/**
 * Re-assignable {@link Vector} binding with compound assignment forms.
 * Each form computes the out-of-place result from the current value
 * and overwrites the binding with it, atomically.
 * <p>
 * The inherited {@code set}, {@code lazySet} and {@code getAndSet} are
 * final and accept {@code null}; a {@code null} binding makes the next
 * compound form throw {@link NullPointerException}. The inherited
 * {@code compareAndSet} compares by identity, not by
 * {@link Vector#equals(Object)}.
 */
public final class VectorRef extends AtomicReference<Vector> {

    public VectorRef(@NotNull final Vector initialValue) {
        super(requireNonNull(initialValue));
    }

    public VectorRef() {
        this(Vector.zero());
    }

    /** {@code this += other} */
    public Vector add(@NotNull final Vector other) {
        return updateAndGet(v -> v.add(other));
    }

    /** {@code this -= other} */
    public Vector sub(@NotNull final Vector other) {
        return updateAndGet(v -> v.sub(other));
    }

    /** {@code this *= scalar} */
    public Vector multiply(final float scalar) {
        return updateAndGet(v -> v.multiply(scalar));
    }

    public Vector multiply(final int scalar) {
        return updateAndGet(v -> v.multiply(scalar));
    }

    /** {@code this /= scalar} */
    public Vector divide(final float scalar) {
        return updateAndGet(v -> v.divide(scalar));
    }

    public Vector divide(final int scalar) {
        return updateAndGet(v -> v.divide(scalar));
    }
}
