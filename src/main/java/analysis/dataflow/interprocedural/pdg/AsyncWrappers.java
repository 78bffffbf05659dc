package analysis.dataflow.interprocedural.pdg;

import java.util.List;

import analysis.ir.BasicBlock;
import analysis.ir.Operand;
import analysis.ir.Place;
import analysis.ir.Procedure;
import analysis.ir.ProcedureKind;
import analysis.ir.Terminator;

/**
 * Recognizes compiler generated wrappers that adapt an asynchronous procedure
 * to the ordinary calling convention
 */
public final class AsyncWrappers {

    /**
     * Methods are static
     */
    private AsyncWrappers() {
        // intentionally blank
    }

    /**
     * @param body
     *            procedure body, may be null
     * @return true if the body is a wrapper whose call can be unwrapped
     */
    public static boolean isAsyncWrapper(Procedure body) {
        return forwardedCall(body) != null;
    }

    /**
     * A wrapper is marked {@link ProcedureKind#ASYNC_WRAPPER} and contains
     * exactly one call, to a statically named procedure, passing parameters 1
     * to n in order and storing the result in the return place.
     *
     * @param body
     *            procedure body, may be null
     * @return the forwarding call, or null if the body is not such a wrapper
     */
    public static Terminator forwardedCall(Procedure body) {
        if (body == null || body.getKind() != ProcedureKind.ASYNC_WRAPPER) {
            return null;
        }
        Terminator found = null;
        for (BasicBlock bb : body.getBlocks()) {
            Terminator t = bb.getTerminator();
            if (t.getKind() != Terminator.Kind.CALL) {
                continue;
            }
            if (found != null) {
                return null;
            }
            found = t;
        }
        if (found == null || found.getStaticCallee() == null || !found.getDestination().equals(Place.local(0))) {
            return null;
        }
        List<Operand> args = found.getArgs();
        if (args.size() != body.getArgCount()) {
            return null;
        }
        for (int i = 0; i < args.size(); i++) {
            Place p = args.get(i).getPlace();
            if (p == null || !p.equals(Place.local(i + 1))) {
                return null;
            }
        }
        return found;
    }
}
