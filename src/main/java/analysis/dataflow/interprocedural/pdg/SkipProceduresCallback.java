package analysis.dataflow.interprocedural.pdg;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import analysis.ir.ProcedureId;

/**
 * Call policy that treats calls of the named procedures opaquely and defers to
 * another policy for every other call
 */
public class SkipProceduresCallback implements CallChangeCallback {

    private final Set<ProcedureId> skipped;
    private final CallChangeCallback otherwise;

    /**
     * @param skipped
     *            procedures never to analyze
     * @param otherwise
     *            policy for the remaining calls
     */
    public SkipProceduresCallback(Collection<ProcedureId> skipped, CallChangeCallback otherwise) {
        this.skipped = new LinkedHashSet<>(skipped);
        this.otherwise = otherwise;
    }

    @Override
    public CallChanges onCall(CallInfo info) {
        if (skipped.contains(info.getCallee())) {
            return new CallChanges(SkipCall.skipOpaque()).withMetadata("skipped", "command line");
        }
        return otherwise.onCall(info);
    }
}
