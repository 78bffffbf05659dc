package analysis.dataflow.interprocedural.infoflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import analysis.ir.Location;
import analysis.ir.ProcedureId;
import analysis.ir.Type;

/**
 * What happened at one call site of an analyzed procedure
 */
public final class CallRecord {

    private final Location location;
    /**
     * Callee after unwrapping, null if not statically known
     */
    private final ProcedureId callee;
    private final List<Type> instantiation;
    private final CallOutcome outcome;
    private final boolean unwrapped;
    private final Map<String, String> metadata;
    /**
     * Results of the callee, null unless {@link CallOutcome#RECURSED}
     */
    private final FlowResults calleeResults;

    public CallRecord(Location location, ProcedureId callee, List<Type> instantiation, CallOutcome outcome,
                      boolean unwrapped, Map<String, String> metadata, FlowResults calleeResults) {
        assert (calleeResults != null) == (outcome == CallOutcome.RECURSED) : "Callee results iff recursed";
        this.location = location;
        this.callee = callee;
        this.instantiation = Collections.unmodifiableList(new ArrayList<>(instantiation));
        this.outcome = outcome;
        this.unwrapped = unwrapped;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.calleeResults = calleeResults;
    }

    public Location getLocation() {
        return location;
    }

    public ProcedureId getCallee() {
        return callee;
    }

    public List<Type> getInstantiation() {
        return instantiation;
    }

    public CallOutcome getOutcome() {
        return outcome;
    }

    /**
     * @return true if the called procedure was a wrapper replaced by the
     *         procedure it forwards to
     */
    public boolean isUnwrapped() {
        return unwrapped;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public FlowResults getCalleeResults() {
        return calleeResults;
    }

    @Override
    public String toString() {
        return location + ": " + (callee == null ? "<indirect>" : callee) + (unwrapped ? " (unwrapped)" : "") + " "
                + outcome;
    }
}
