package analysis.dataflow.interprocedural.pdg;

import analysis.ir.Location;
import analysis.ir.ProcedureId;

/**
 * Contexts are the most recent call sites on the path from the root
 */
public class CallSiteSensitive extends CallContextSelector {

    /**
     * Default depth of call sites to keep track of
     */
    public static final int DEFAULT_SENSITIVITY = 2;
    /**
     * Depth of the call sites to keep track of
     */
    private final int sensitivity;

    /**
     * Create a call site sensitive selector with the default depth
     */
    public CallSiteSensitive() {
        this(DEFAULT_SENSITIVITY);
    }

    /**
     * Create a call site sensitive selector that tracks up to
     * <code>sensitivity</code> call sites
     *
     * @param sensitivity
     *            depth of the call site stack
     */
    public CallSiteSensitive(int sensitivity) {
        if (sensitivity < 0) {
            throw new IllegalArgumentException("Negative call site sensitivity " + sensitivity);
        }
        this.sensitivity = sensitivity;
    }

    public int getSensitivity() {
        return sensitivity;
    }

    @Override
    public CallContext initialContext() {
        return CallContext.empty();
    }

    @Override
    public CallContext merge(CallContext callerContext, ProcedureId caller, Location callSite, ProcedureId callee) {
        return callerContext.push(new CallContext.Site(caller, callSite), sensitivity);
    }

    @Override
    public String toString() {
        return "cs(" + this.sensitivity + ")";
    }
}
