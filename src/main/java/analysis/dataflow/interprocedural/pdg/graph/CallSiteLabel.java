package analysis.dataflow.interprocedural.pdg.graph;

import java.util.Map;

import analysis.dataflow.interprocedural.infoflow.CallOutcome;
import analysis.dataflow.interprocedural.infoflow.CallRecord;
import analysis.dataflow.interprocedural.pdg.graph.node.ProcedureNode;
import analysis.ir.ProcedureId;

/**
 * How one call site of a graph node was treated, kept for later queries
 */
public final class CallSiteLabel {

    private final GraphLocation site;
    private final CallRecord record;
    /**
     * Node for the callee, null if the call has no node
     */
    private final ProcedureNode calleeNode;

    public CallSiteLabel(GraphLocation site, CallRecord record, ProcedureNode calleeNode) {
        this.site = site;
        this.record = record;
        this.calleeNode = calleeNode;
    }

    public GraphLocation getSite() {
        return site;
    }

    /**
     * @return the callee, null if it was not known statically
     */
    public ProcedureId getCallee() {
        return record.getCallee();
    }

    public CallOutcome getOutcome() {
        return record.getOutcome();
    }

    public boolean isUnwrapped() {
        return record.isUnwrapped();
    }

    /**
     * @return metadata attached by the call policy
     */
    public Map<String, String> getMetadata() {
        return record.getMetadata();
    }

    public ProcedureNode getCalleeNode() {
        return calleeNode;
    }

    @Override
    public String toString() {
        return site + " -> " + getCallee() + " " + getOutcome() + (getMetadata().isEmpty() ? "" : " " + getMetadata());
    }
}
