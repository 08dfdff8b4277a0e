package sunmisc.planar.geom;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

@State(Scope.Thread)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@BenchmarkMode(Mode.Throughput)
@Warmup(iterations = 2, time = 1)
@Measurement(iterations = 12, time = 1)
@Threads(1)
@Fork(1)
public class LengthVsLengthSquared {
    @Param({"121.545454", "0.322"})
    float radius;
    Vector a, b;

    @Setup
    public void init() {
        this.a = Vector.of(this.radius, -this.radius);
        this.b = Vector.of(this.radius / 2, this.radius * 3);
    }

    @Benchmark
    public boolean compareLength() {
        return this.a.length() < this.b.length();
    }

    @Benchmark
    public boolean compareLengthSquared() {
        return this.a.lengthSquared() < this.b.lengthSquared();
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(LengthVsLengthSquared.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
