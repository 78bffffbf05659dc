package analysis.dataflow.interprocedural.infoflow;

import java.util.ArrayList;
import java.util.List;

import util.indexed.IndexSet;
import analysis.ir.ClosureKind;
import analysis.ir.Location;
import analysis.ir.Operand;
import analysis.ir.Place;
import analysis.ir.PlaceType;
import analysis.ir.PlaceTypes;
import analysis.ir.Procedure;
import analysis.ir.ProcedureId;
import analysis.ir.ProcedureSignature;
import analysis.ir.ProjectionElem;
import analysis.ir.Terminator;
import analysis.ir.Type;
import analysis.ir.TypeOracle;

/**
 * Replaces a call by the effect of the callee's body. The callee's states at
 * its return terminators are joined into a summary, and every summary row for
 * the return place or a parameter is translated onto the caller's destination
 * or actual argument. Calls that cannot be analyzed this way are rejected, and
 * the caller falls back to the conservative treatment.
 */
public class RecursiveCallInliner {

    /**
     * Outcome of an attempt to inline a call
     */
    public static final class Result {
        private final CallOutcome outcome;
        private final List<Mutation> mutations;
        private final FlowResults calleeResults;

        Result(CallOutcome outcome, List<Mutation> mutations, FlowResults calleeResults) {
            this.outcome = outcome;
            this.mutations = mutations;
            this.calleeResults = calleeResults;
        }

        static Result rejected(CallOutcome outcome) {
            return new Result(outcome, null, null);
        }

        public CallOutcome getOutcome() {
            return outcome;
        }

        /**
         * @return the translated mutations, null if the call was rejected
         */
        public List<Mutation> getMutations() {
            return mutations;
        }

        public FlowResults getCalleeResults() {
            return calleeResults;
        }
    }

    private final InterproceduralInfoFlow engine;

    public RecursiveCallInliner(InterproceduralInfoFlow engine) {
        this.engine = engine;
    }

    /**
     * Try to analyze the callee of a call and translate its effects
     *
     * @param caller
     *            procedure containing the call
     * @param call
     *            call terminator
     * @param callee
     *            statically known callee, null for indirect calls and dynamic
     *            dispatch
     * @param instantiation
     *            generic arguments of the callee
     * @return the outcome, with the mutations to apply at the call if the
     *         callee was analyzed
     */
    public Result inline(Procedure caller, Terminator call, ProcedureId callee, List<Type> instantiation) {
        CallOutcome rejection = check(caller, call, callee, instantiation);
        if (rejection != null) {
            if (engine.getSettings().getOutputLevel() >= 2) {
                System.err.println("\tNot recursing into " + callee + " from " + caller.getId() + ": " + rejection);
            }
            return Result.rejected(rejection);
        }

        Procedure calleeBody = engine.getProgram().getBody(callee);
        FlowResults results = engine.computeFlow(calleeBody);
        FlowDomain summary = results.getExitSummary();
        return new Result(CallOutcome.RECURSED, translate(caller, calleeBody, call, summary), results);
    }

    /**
     * @return the reason the call cannot be inlined, null if it can
     */
    private CallOutcome check(Procedure caller, Terminator call, ProcedureId callee, List<Type> instantiation) {
        if (!engine.getSettings().isRecurse()) {
            return CallOutcome.OPAQUE_DISABLED;
        }
        if (callee == null) {
            return CallOutcome.OPAQUE_NOT_STATIC;
        }
        ProcedureSignature sig = engine.getProgram().getSignature(callee);
        Type returnType = sig != null ? sig.getReturnType(instantiation) : null;
        if (returnType != null && returnType.isNever()) {
            return CallOutcome.OPAQUE_DIVERGES;
        }
        Procedure calleeBody = engine.getProgram().getBody(callee);
        if (calleeBody == null) {
            engine.getScopeReport().setLeftLocalScope();
            return CallOutcome.OPAQUE_EXTERNAL;
        }
        if (calleeBody.hasUnsafeBlocks()) {
            return CallOutcome.OPAQUE_UNSAFE;
        }
        if (hasMutatingClosureInput(caller, call)) {
            return CallOutcome.OPAQUE_CLOSURE;
        }
        if (engine.isBeingAnalyzed(callee)) {
            return CallOutcome.OPAQUE_RECURSIVE;
        }
        return null;
    }

    /**
     * @return true if the type of an actual argument mentions a closure that
     *         may mutate its captures
     */
    private boolean hasMutatingClosureInput(Procedure caller, Terminator call) {
        List<Type> inputs = new ArrayList<>();
        for (Operand op : call.getArgs()) {
            if (op.getPlace() != null) {
                PlaceType t = PlaceTypes.typeOf(caller, op.getPlace(), engine.getTypes());
                if (t != null) {
                    inputs.add(t.getType());
                }
            }
            else if (op.getConstantType() != null) {
                inputs.add(op.getConstantType());
            }
        }
        for (Type t : inputs) {
            if (t.containsClosure(ClosureKind.FN_MUT, ClosureKind.FN_ONCE)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Turn the callee's summary into mutations at the call site. A parameter
     * row only counts as mutated if it has more than one dependency, since each
     * parameter place starts out depending on its own argument location. The
     * inputs of a mutation are the other parameter rows whose dependencies are
     * contained in the mutated row's.
     */
    List<Mutation> translate(Procedure caller, Procedure calleeBody, Terminator call, FlowDomain summary) {
        List<Mutation> mutations = new ArrayList<>();
        for (Place child : summary.rows()) {
            Place parent = translatePlace(caller, calleeBody, call, child, true);
            if (parent == null) {
                continue;
            }
            boolean wasReturn = child.getLocal() == 0;
            IndexSet<Location> childDeps = summary.rowSet(child);
            if (!wasReturn && childDeps.size() <= 1) {
                continue;
            }

            // The callee's return place starts out unrelated to the caller's
            // destination, so it is never read back as an input
            List<Place> inputs = new ArrayList<>();
            for (Place row : summary.rows()) {
                if (row.equals(child) || row.getLocal() == 0) {
                    continue;
                }
                if (childDeps.isSuperset(summary.rowSet(row))) {
                    Place p = translatePlace(caller, calleeBody, call, row, false);
                    if (p != null && !inputs.contains(p)) {
                        inputs.add(p);
                    }
                }
            }
            MutationReason reason = wasReturn ? MutationReason.CALL_RETURN : MutationReason.callArgument(child
                    .getLocal() - 1);
            MutationStatus status = wasReturn ? MutationStatus.DEFINITE : MutationStatus.POSSIBLE;
            mutations.add(new Mutation(parent, inputs, reason, status));
        }
        return mutations;
    }

    /**
     * Rewrite a place of the callee onto the caller's destination or actual
     * argument, replaying the callee's projection on top of it. The replay
     * stops before a field that is not visible from the caller, before an
     * index step, and wherever the type cannot be computed.
     *
     * @param mutated
     *            true if the place is being translated as a mutation target, in
     *            which case by-value parameters are not translated
     * @return the caller place, or null if the place has no counterpart
     */
    Place translatePlace(Procedure caller, Procedure calleeBody, Terminator call, Place child, boolean mutated) {
        TypeOracle types = engine.getTypes();
        PlaceType childType = PlaceTypes.typeOf(calleeBody, child, types);
        if (childType != null && childType.getType().isUnit()) {
            return null;
        }
        int local = child.getLocal();
        boolean isArg = local >= 1 && local <= calleeBody.getArgCount();
        if (!(local == 0 || isArg && (!mutated || child.isIndirect()))) {
            return null;
        }

        Place root;
        if (local == 0) {
            root = call.getDestination();
        }
        else if (local - 1 < call.getArgs().size()) {
            root = call.getArgs().get(local - 1).getPlace();
        }
        else {
            root = null;
        }
        if (root == null) {
            return null;
        }

        Place result = root;
        PlaceType ty = PlaceTypes.typeOf(caller, root, types);
        for (ProjectionElem elem : child.getProjection()) {
            if (ty == null || elem.getKind() == ProjectionElem.Kind.INDEX) {
                break;
            }
            if (elem.getKind() == ProjectionElem.Kind.FIELD
                    && !types.isFieldAccessible(ty, elem.getField(), caller.getId())) {
                break;
            }
            PlaceType next = types.projectionType(ty, elem);
            if (next == null) {
                break;
            }
            result = result.project(elem);
            ty = next;
        }
        return result;
    }
}
