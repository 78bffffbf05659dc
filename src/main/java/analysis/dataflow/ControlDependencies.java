package analysis.dataflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import util.indexed.IndexSet;
import util.indexed.IndexedDomain;
import analysis.ir.Procedure;
import analysis.ir.Terminator;

/**
 * Control dependencies between the basic blocks of a procedure, computed from
 * post-dominators. Block B is control dependent on block A if A has more than
 * one successor, B post-dominates some successor of A, and B does not strictly
 * post-dominate A. Unwind edges are ignored.
 */
public class ControlDependencies {

    private final Procedure body;
    /**
     * Blocks plus a virtual exit with index equal to the number of blocks
     */
    private final IndexedDomain<Integer> blocks = new IndexedDomain<>();
    /**
     * post-dominators of each block, including the block itself
     */
    private final List<IndexSet<Integer>> postDominators;
    /**
     * for each block the branching blocks it is control dependent on
     */
    private final List<Set<Integer>> controllers;

    /**
     * Compute the control dependencies of a procedure
     *
     * @param body
     *            procedure to analyze
     */
    public ControlDependencies(Procedure body) {
        this.body = body;
        int n = body.getBlocks().size();
        for (int b = 0; b <= n; b++) {
            blocks.intern(b);
        }
        this.postDominators = computePostDominators(n);
        this.controllers = computeControllers(n);
    }

    private List<Integer> exitSuccessors(int b, int exit) {
        Terminator t = body.getBlock(b).getTerminator();
        List<Integer> targets = t.getTargets();
        if (targets.isEmpty()) {
            return Collections.singletonList(exit);
        }
        return targets;
    }

    private List<IndexSet<Integer>> computePostDominators(int n) {
        List<IndexSet<Integer>> pdom = new ArrayList<>(n + 1);
        IndexSet<Integer> all = new IndexSet<>(blocks, blocks.values());
        for (int b = 0; b < n; b++) {
            pdom.add(all.copy());
        }
        IndexSet<Integer> exitSet = new IndexSet<>(blocks);
        exitSet.insert(n);
        pdom.add(exitSet);

        List<Integer> order = new ArrayList<>(body.getReversePostorder());
        // post-dominators converge fastest in postorder
        Collections.reverse(order);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int b : order) {
                IndexSet<Integer> s = null;
                for (int succ : exitSuccessors(b, n)) {
                    if (s == null) {
                        s = pdom.get(succ).copy();
                    }
                    else {
                        s.intersect(pdom.get(succ));
                    }
                }
                s.insert(b);
                if (!s.equals(pdom.get(b))) {
                    pdom.set(b, s);
                    changed = true;
                }
            }
        }
        return pdom;
    }

    private List<Set<Integer>> computeControllers(int n) {
        List<Set<Integer>> cd = new ArrayList<>(n);
        for (int b = 0; b < n; b++) {
            cd.add(new LinkedHashSet<Integer>());
        }
        for (int a = 0; a < n; a++) {
            Set<Integer> targets = new LinkedHashSet<>(body.getBlock(a).getTerminator().getTargets());
            if (targets.size() < 2) {
                continue;
            }
            IndexSet<Integer> pdomA = postDominators.get(a);
            for (int s : targets) {
                for (int b : pdomA.getDomain().values()) {
                    if (b == n || !postDominators.get(s).contains(b)) {
                        continue;
                    }
                    if (b == a || !pdomA.contains(b)) {
                        cd.get(b).add(a);
                    }
                }
            }
        }
        return cd;
    }

    /**
     * @param block
     *            block index
     * @return the branching blocks whose outcome decides whether the block
     *         executes
     */
    public Set<Integer> getControllers(int block) {
        return Collections.unmodifiableSet(controllers.get(block));
    }

    /**
     * @param block
     *            block index
     * @param candidate
     *            possible post-dominator
     * @return true if every path from the block to the exit goes through the
     *         candidate
     */
    public boolean postDominates(int candidate, int block) {
        return postDominators.get(block).contains(candidate);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Control dependencies of " + body.getId() + ":");
        for (int b = 0; b < controllers.size(); b++) {
            if (!controllers.get(b).isEmpty()) {
                sb.append(" bb").append(b).append(" <- ").append(controllers.get(b));
            }
        }
        return sb.toString();
    }
}
