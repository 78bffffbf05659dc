package analysis.dataflow.interprocedural.pdg;

import analysis.ir.Location;
import analysis.ir.ProcedureId;

/**
 * A single context for every procedure
 */
public class ContextInsensitive extends CallContextSelector {

    @Override
    public CallContext initialContext() {
        return CallContext.empty();
    }

    @Override
    public CallContext merge(CallContext callerContext, ProcedureId caller, Location callSite, ProcedureId callee) {
        return initialContext();
    }

    @Override
    public String toString() {
        return "ContextInsensitive";
    }
}
