package analysis.dataflow.interprocedural.pdg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import analysis.ir.Location;
import analysis.ir.ProcedureId;
import analysis.ir.Type;

/**
 * Description of a statically named call site, handed to a
 * {@link CallChangeCallback}
 */
public final class CallInfo {

    private final ProcedureId caller;
    private final Location location;
    private final ProcedureId callee;
    private final List<Type> instantiation;
    private final boolean dynamicDispatch;
    private final boolean asyncWrapper;

    public CallInfo(ProcedureId caller, Location location, ProcedureId callee, List<Type> instantiation,
                    boolean dynamicDispatch, boolean asyncWrapper) {
        this.caller = caller;
        this.location = location;
        this.callee = callee;
        this.instantiation = Collections.unmodifiableList(new ArrayList<>(instantiation));
        this.dynamicDispatch = dynamicDispatch;
        this.asyncWrapper = asyncWrapper;
    }

    public ProcedureId getCaller() {
        return caller;
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

    /**
     * @return true if the callee is a trait method resolved at run time
     */
    public boolean isDynamicDispatch() {
        return dynamicDispatch;
    }

    /**
     * @return true if the callee is a compiler generated async wrapper
     */
    public boolean isAsyncWrapper() {
        return asyncWrapper;
    }

    @Override
    public String toString() {
        return caller + " " + location + " -> " + callee;
    }
}
