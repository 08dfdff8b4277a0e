package sunmisc.planar.geom;

import org.openjdk.jcstress.Main;
import org.openjdk.jcstress.annotations.*;
import org.openjdk.jcstress.infra.results.FF_Result;
import org.openjdk.jcstress.infra.results.L_Result;

import static org.openjdk.jcstress.annotations.Expect.ACCEPTABLE;
import static org.openjdk.jcstress.annotations.Expect.FORBIDDEN;

public class VectorRefStress {

    @JCStressTest
    @State
    @Outcome(id = "<3.0, 3.0>", expect = ACCEPTABLE, desc = "Every addition applied")
    @Outcome(expect = FORBIDDEN, desc = "Lost update")
    public static class ConcurrentAdd {
        private final VectorRef ref = new VectorRef();

        @Actor
        public void actor1() {
            this.ref.add(Vector.one());
        }

        @Actor
        public void actor2() {
            this.ref.add(Vector.one());
        }

        @Actor
        public void actor3() {
            this.ref.add(Vector.one());
        }

        @Arbiter
        public void arbiter(final L_Result r) {
            r.r1 = this.ref.get().toString();
        }
    }

    @JCStressTest
    @State
    @Outcome(id = {"0.0, 0.0", "3.0, 4.0"}, expect = ACCEPTABLE)
    @Outcome(expect = FORBIDDEN, desc = "Torn vector")
    public static class Publication {
        private Vector vector = Vector.zero();

        @Actor
        public void writer() {
            this.vector = Vector.of(3, 4);
        }

        @Actor
        public void reader(final FF_Result r) {
            final Vector v = this.vector;
            r.r1 = v.x();
            r.r2 = v.y();
        }
    }

    public static void main(final String[] args) throws Exception {
        Main.main(args);
    }
}
