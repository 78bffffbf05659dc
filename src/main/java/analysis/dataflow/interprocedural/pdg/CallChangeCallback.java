package analysis.dataflow.interprocedural.pdg;

/**
 * Call policy: consulted once for every statically named call site, before the
 * analysis decides whether it can recurse into the callee
 */
public interface CallChangeCallback {

    /**
     * @param info
     *            the call site
     * @return how to treat the call
     */
    CallChanges onCall(CallInfo info);
}
