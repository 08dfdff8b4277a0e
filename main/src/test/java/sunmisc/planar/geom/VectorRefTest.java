package sunmisc.planar.geom;

import org.hamcrest.CoreMatchers;
import org.hamcrest.MatcherAssert;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

public final class VectorRefTest {

    @Test
    public void bindsZeroByDefault() {
        MatcherAssert.assertThat(new VectorRef().get(), CoreMatchers.equalTo(Vector.zero()));
    }

    @Test
    public void compoundFormsOverwriteBinding() {
        final VectorRef ref = new VectorRef(Vector.of(5, 10));
        MatcherAssert.assertThat(ref.add(Vector.of(1, -2)), CoreMatchers.equalTo(Vector.of(6, 8)));
        MatcherAssert.assertThat(ref.sub(Vector.of(2, 2)), CoreMatchers.equalTo(Vector.of(4, 6)));
        MatcherAssert.assertThat(ref.multiply(3), CoreMatchers.equalTo(Vector.of(12, 18)));
        MatcherAssert.assertThat(ref.divide(4), CoreMatchers.equalTo(Vector.of(3, 4.5f)));
        MatcherAssert.assertThat(ref.multiply(0.5f), CoreMatchers.equalTo(Vector.of(1.5f, 2.25f)));
        MatcherAssert.assertThat(ref.divide(0.25f), CoreMatchers.equalTo(Vector.of(6, 9)));
        MatcherAssert.assertThat(ref.get(), CoreMatchers.equalTo(Vector.of(6, 9)));
    }

    @Test
    public void compoundFormMatchesOutOfPlace() {
        final Vector origin = Vector.of(-3, 7);
        final VectorRef ref = new VectorRef(origin);
        ref.sub(Vector.one());
        MatcherAssert.assertThat(ref.get(), CoreMatchers.equalTo(origin.sub(Vector.one())));
        MatcherAssert.assertThat(origin, CoreMatchers.equalTo(Vector.of(-3, 7)));
    }

    @Test
    public void rejectsNullBinding() {
        Assertions.assertThrows(NullPointerException.class, () -> new VectorRef(null));
    }

    @Test
    public void nullSetBreaksNextCompoundForm() {
        final VectorRef ref = new VectorRef();
        ref.set(null);
        Assertions.assertThrows(NullPointerException.class, () -> ref.add(Vector.one()));
    }

    @Test
    public void compareAndSetUsesIdentity() {
        final VectorRef ref = new VectorRef(Vector.of(2, 3));
        Assertions.assertFalse(
                ref.compareAndSet(Vector.of(2, 3), Vector.one()),
                "A tolerance-equal but distinct vector must not match"
        );
        Assertions.assertTrue(ref.compareAndSet(ref.get(), Vector.one()));
        MatcherAssert.assertThat(ref.get(), CoreMatchers.equalTo(Vector.one()));
    }

    @Test
    public void displaysBoundVector() {
        Assertions.assertEquals("<1.0, 0.0>", new VectorRef(Vector.xAxis()).toString());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 4, 32, 128})
    public void concurrentAddLosesNoUpdate(final int attempts) throws InterruptedException {
        final int size = 1 << 12;
        final VectorRef ref = new VectorRef();
        final ExecutorService executor = Executors.newWorkStealingPool();
        try {
            for (int a = 0; a < size; ++a) {
                executor.execute(() -> {
                    for (int attempt = 0; attempt < attempts; ++attempt) {
                        ref.add(Vector.one());
                    }
                });
            }
        } finally {
            executor.shutdown();
        }
        Assertions.assertTrue(
                executor.awaitTermination(1, TimeUnit.MINUTES),
                "Executor must terminate"
        );
        final int expected = size * attempts;
        MatcherAssert.assertThat(
                String.format("Every one of %s additions must be applied", expected),
                ref.get(),
                CoreMatchers.equalTo(Vector.of(expected, expected))
        );
    }
}
