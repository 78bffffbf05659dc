package unit;

import static unit.ExamplePrograms.constInt;
import static unit.ExamplePrograms.loc;
import static unit.ExamplePrograms.local;

import java.util.Arrays;

import junit.framework.TestCase;
import analysis.dataflow.DataFlow;
import analysis.dataflow.util.AbstractValue;
import analysis.ir.Location;
import analysis.ir.Operand;
import analysis.ir.Procedure;
import analysis.ir.ProcedureBuilder;
import analysis.ir.Rvalue;
import analysis.ir.Statement;
import analysis.ir.Terminator;
import analysis.ir.Type;

/**
 * Fixed-point iteration of the intra-procedural solver on loops that need many
 * trips around the back edge
 */
public class TestDataFlow extends TestCase {

    /**
     * Counter that only grows under join
     */
    private static final class Counter implements AbstractValue<Counter> {
        int value;

        Counter(int value) {
            this.value = value;
        }

        @Override
        public boolean leq(Counter that) {
            return value <= that.value;
        }

        @Override
        public boolean isBottom() {
            return value == 0;
        }

        @Override
        public boolean join(Counter that) {
            if (that.value > value) {
                value = that.value;
                return true;
            }
            return false;
        }

        @Override
        public Counter copy() {
            return new Counter(value);
        }
    }

    /**
     * Each statement increments the counter up to a limit. With no limit the
     * transfer function keeps growing the entry state of the loop.
     */
    private static final class Counting extends DataFlow<Counter> {
        private final int limit;
        private final boolean bounded;

        Counting(Procedure body, int limit, boolean bounded) {
            super(body);
            this.limit = limit;
            this.bounded = bounded;
        }

        void run() {
            dataflow();
        }

        @Override
        protected Counter initialState() {
            return new Counter(0);
        }

        @Override
        protected void flowStatement(Counter state, Statement s, Location loc) {
            if (!bounded || state.value < limit) {
                state.value++;
            }
        }

        @Override
        protected void flowTerminator(Counter state, Terminator t, Location loc) {
            // nothing
        }

        @Override
        protected long latticeHeight() {
            return limit;
        }
    }

    /**
     * <pre>
     * bb0[0] goto bb1
     * bb1[0] x = 0     bb1[1] switch x [bb1, bb2]
     * bb2[0] return
     * </pre>
     */
    private static Procedure loop() {
        ProcedureBuilder b = new ProcedureBuilder("m::spin", Type.unit());
        int x = b.local("x", Type.integer());
        int body = b.newBlock();
        int exit = b.newBlock();
        b.terminate(Terminator.jump(body));
        b.atBlock(body);
        b.assign(local(x), Rvalue.use(constInt(0)));
        b.terminate(Terminator.switchInt(Operand.copy(local(x)), Arrays.asList(body, exit)));
        b.atBlock(exit);
        b.ret();
        return b.build();
    }

    public void testTallLatticeReachesFixedPoint() {
        Counting c = new Counting(loop(), 1000, true);
        c.run();
        assertEquals(1000, c.getStateAfter(loc(1, 0)).value);
        assertEquals(1000, c.getBlockEntryState(2).value);
    }

    public void testGrowthBeyondLatticeHeight() {
        Counting c = new Counting(loop(), 10, false);
        try {
            c.run();
        }
        catch (IllegalStateException e) {
            return;
        }
        fail("Should have thrown exception");
    }
}
