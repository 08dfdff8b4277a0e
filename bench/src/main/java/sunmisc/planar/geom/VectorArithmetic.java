package sunmisc.planar.geom;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@Threads(2)
public class VectorArithmetic {
    private static final int SIZE = 64;
    private Vector[] points;
    private VectorRef shared;

    public static void main(final String[] args) throws RunnerException {
        new Runner(new OptionsBuilder()
                .include(VectorArithmetic.class.getSimpleName())
                .build()
        ).run();
    }

    @Setup
    public void init() {
        final ThreadLocalRandom random = ThreadLocalRandom.current();
        this.points = new Vector[SIZE];
        for (int i = 0; i < SIZE; ++i) {
            this.points[i] = Vector.of(random.nextFloat(), random.nextFloat());
        }
        this.shared = new VectorRef();
    }

    @Benchmark
    public Vector sum() {
        Vector acc = Vector.zero();
        for (final Vector p : this.points) {
            acc = acc.add(p);
        }
        return acc;
    }

    @Benchmark
    public void normalize(final Blackhole bh) {
        for (final Vector p : this.points) {
            bh.consume(p.normalized());
        }
    }

    @Benchmark
    public Vector clamp() {
        final Vector min = Vector.of(0.25f, 0.25f), max = Vector.of(0.75f, 0.75f);
        final int r = ThreadLocalRandom.current().nextInt(SIZE);
        return this.points[r].clamp(min, max);
    }

    @Benchmark
    public Vector contendedAdd() {
        final int r = ThreadLocalRandom.current().nextInt(SIZE);
        return this.shared.add(this.points[r]);
    }
}
