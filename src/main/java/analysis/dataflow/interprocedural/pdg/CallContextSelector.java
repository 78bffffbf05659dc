package analysis.dataflow.interprocedural.pdg;

import analysis.ir.Location;
import analysis.ir.ProcedureId;

/**
 * Chooses the context in which a callee is placed in the dependence graph.
 * Two calls reaching the same procedure with the same instantiation in the
 * same context share one graph node.
 */
public abstract class CallContextSelector {

    /**
     * @return context of the root procedure
     */
    public abstract CallContext initialContext();

    /**
     * Compute the context of a callee
     *
     * @param callerContext
     *            context of the calling node
     * @param caller
     *            calling procedure
     * @param callSite
     *            location of the call in the caller
     * @param callee
     *            procedure being called
     * @return context for the callee
     */
    public abstract CallContext merge(CallContext callerContext, ProcedureId caller, Location callSite,
                                      ProcedureId callee);
}
