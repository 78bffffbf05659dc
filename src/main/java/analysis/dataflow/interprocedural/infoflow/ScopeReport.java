package analysis.dataflow.interprocedural.infoflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import analysis.ir.ProcedureId;

/**
 * Accumulates, for one query, the places where the analysis fell back to a
 * conservative treatment. Callers inspect it to judge how precise a result is.
 */
public class ScopeReport {

    /**
     * A call site given the conservative treatment
     */
    public static final class Entry {
        private final ProcedureId caller;
        private final CallRecord call;

        Entry(ProcedureId caller, CallRecord call) {
            this.caller = caller;
            this.call = call;
        }

        public ProcedureId getCaller() {
            return caller;
        }

        public CallRecord getCall() {
            return call;
        }

        @Override
        public String toString() {
            return caller + " " + call;
        }
    }

    private boolean leftLocalScope = false;
    private final List<Entry> conservativeCalls = new ArrayList<>();

    /**
     * Note that a procedure without a body in the analyzed program was reached
     */
    public void setLeftLocalScope() {
        leftLocalScope = true;
    }

    /**
     * @return true if a procedure outside the analyzed program was reached
     */
    public boolean hasLeftLocalScope() {
        return leftLocalScope;
    }

    void recordConservative(ProcedureId caller, CallRecord call) {
        conservativeCalls.add(new Entry(caller, call));
    }

    /**
     * @return conservatively treated calls in the order they were first seen
     */
    public List<Entry> getConservativeCalls() {
        return Collections.unmodifiableList(conservativeCalls);
    }

    /**
     * @return true if every call reached was analyzed or had its effects
     *         supplied by the call policy
     */
    public boolean isPrecise() {
        return !leftLocalScope && conservativeCalls.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Left local scope: ").append(leftLocalScope).append("\n");
        sb.append("Conservative calls: ").append(conservativeCalls.size()).append("\n");
        for (Entry e : conservativeCalls) {
            sb.append("\t").append(e).append("\n");
        }
        return sb.toString();
    }
}
