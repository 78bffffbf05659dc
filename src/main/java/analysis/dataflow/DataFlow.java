package analysis.dataflow;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import util.WorkQueue;
import analysis.dataflow.util.AbstractValue;
import analysis.ir.BasicBlock;
import analysis.ir.Location;
import analysis.ir.Procedure;
import analysis.ir.Statement;
import analysis.ir.Terminator;

/**
 * Base class for a flow-sensitive forward intra-procedural data-flow analysis.
 * Blocks are visited in reverse postorder and revisited whenever the state at
 * their entry grows, until a fixed point is reached. The state after every
 * statement and terminator is recorded.
 *
 * @param <F>
 *            type of the data-flow facts, which are modified in place by the
 *            transfer functions
 */
public abstract class DataFlow<F extends AbstractValue<F>> {

    /**
     * Procedure being analyzed
     */
    protected final Procedure body;
    /**
     * Joined state at the entry of each block that has been reached
     */
    private final Map<Integer, F> blockEntry = new HashMap<>();
    /**
     * State after each analyzed location
     */
    private final Map<Location, F> after = new HashMap<>();
    /**
     * determines printing volume
     */
    protected int outputLevel = 0;

    /**
     * @param body
     *            procedure to analyze
     */
    public DataFlow(Procedure body) {
        this.body = body;
    }

    /**
     * @return state on entry to the procedure
     */
    protected abstract F initialState();

    /**
     * Apply the effect of a statement
     *
     * @param state
     *            state before the statement, modified in place
     * @param s
     *            statement
     * @param loc
     *            location of the statement
     */
    protected abstract void flowStatement(F state, Statement s, Location loc);

    /**
     * Apply the effect of a terminator, the same state flows to every successor
     *
     * @param state
     *            state before the terminator, modified in place
     * @param t
     *            terminator
     * @param loc
     *            location of the terminator
     */
    protected abstract void flowTerminator(F state, Terminator t, Location loc);

    /**
     * Upper bound on the number of times the entry state of a single block can
     * grow. A block is revisited only when its entry state grows, so a block
     * visited more often than one plus this bound means a transfer function is
     * not monotone.
     *
     * @return height of the lattice of data-flow facts
     */
    protected abstract long latticeHeight();

    /**
     * Run the analysis to a fixed point
     */
    protected final void dataflow() {
        blockEntry.put(0, initialState());
        WorkQueue<Integer> q = new WorkQueue<>(body.getReversePostorder());
        q.add(0);
        Map<Integer, Integer> visits = new HashMap<>();
        Integer b;
        while ((b = q.poll()) != null) {
            Integer count = visits.get(b);
            count = count == null ? 1 : count + 1;
            visits.put(b, count);
            if (count > latticeHeight() + 1) {
                throw new IllegalStateException("Analyzed bb" + b + " " + count + " times in " + body.getId()
                        + ", the entry state cannot grow that often");
            }
            if (outputLevel >= 4) {
                System.err.println("FLOWING bb" + b + " in " + body.getId());
            }

            BasicBlock bb = body.getBlock(b);
            F state = blockEntry.get(b).copy();
            List<Statement> stmts = bb.getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                Location loc = Location.make(b, i);
                flowStatement(state, stmts.get(i), loc);
                after.put(loc, state.copy());
            }
            Location termLoc = Location.make(b, bb.getTerminatorIndex());
            flowTerminator(state, bb.getTerminator(), termLoc);
            after.put(termLoc, state.copy());

            for (int succ : bb.getTerminator().getSuccessors()) {
                F existing = blockEntry.get(succ);
                if (existing == null) {
                    blockEntry.put(succ, state.copy());
                    q.add(succ);
                }
                else if (existing.join(state)) {
                    q.add(succ);
                }
            }
        }
        if (outputLevel >= 3) {
            System.err.println("Fixed point for " + body.getId() + " after " + sum(visits) + " block visits");
        }
    }

    private static int sum(Map<Integer, Integer> m) {
        int s = 0;
        for (int i : m.values()) {
            s += i;
        }
        return s;
    }

    /**
     * @param loc
     *            location in the procedure
     * @return the state after the location, or null if it is unreachable
     */
    public F getStateAfter(Location loc) {
        return after.get(loc);
    }

    /**
     * @param block
     *            block index
     * @return the joined state at the entry of the block, null if unreachable
     */
    public F getBlockEntryState(int block) {
        return blockEntry.get(block);
    }

    /**
     * @return the procedure this data-flow is over
     */
    public Procedure getBody() {
        return body;
    }

    public void setOutputLevel(int outputLevel) {
        this.outputLevel = outputLevel;
    }
}
