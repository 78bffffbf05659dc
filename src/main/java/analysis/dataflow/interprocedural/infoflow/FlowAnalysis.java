package analysis.dataflow.interprocedural.infoflow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import util.indexed.IndexSet;
import analysis.dataflow.ControlDependencies;
import analysis.dataflow.DataFlow;
import analysis.dataflow.interprocedural.pdg.AsyncWrappers;
import analysis.dataflow.interprocedural.pdg.CallChanges;
import analysis.dataflow.interprocedural.pdg.CallInfo;
import analysis.dataflow.interprocedural.pdg.FakeEffect;
import analysis.dataflow.interprocedural.pdg.FakeEffectKind;
import analysis.dataflow.interprocedural.pdg.SkipCall;
import analysis.ir.Location;
import analysis.ir.Mutability;
import analysis.ir.Operand;
import analysis.ir.Place;
import analysis.ir.Procedure;
import analysis.ir.ProcedureId;
import analysis.ir.ProjectionElem;
import analysis.ir.Statement;
import analysis.ir.Terminator;
import analysis.ir.Type;

/**
 * Flow-sensitive dependency analysis of one procedure. The state maps each
 * place to the locations that may have influenced its value. Calls are handed
 * to the call policy and then to the {@link RecursiveCallInliner}, and fall
 * back to the conservative treatment of {@link MutationVisitor#opaqueCall}.
 */
public class FlowAnalysis extends DataFlow<FlowDomain> {

    private final InterproceduralInfoFlow engine;
    private final PlaceInfo placeInfo;
    private final MutationVisitor visitor;
    /**
     * null if control dependencies are turned off
     */
    private final ControlDependencies controlDependencies;
    private FlowDomain initial;
    /**
     * Mutation witnesses by location, at most one per mutated place and reason
     */
    private final Map<Location, List<MutationRecord>> records = new LinkedHashMap<>();
    /**
     * Mutations of each call site, computed the first time it is analyzed
     */
    private final Map<Location, List<Mutation>> callMutations = new HashMap<>();
    private final Map<Location, CallRecord> callRecords = new LinkedHashMap<>();

    /**
     * @param engine
     *            engine used to analyze callees
     * @param placeInfo
     *            places and aliases of the procedure
     */
    public FlowAnalysis(InterproceduralInfoFlow engine, PlaceInfo placeInfo) {
        super(placeInfo.getBody());
        this.engine = engine;
        this.placeInfo = placeInfo;
        this.visitor = new MutationVisitor(placeInfo);
        this.controlDependencies = engine.getSettings().isControlDependencies() ? new ControlDependencies(body)
                : null;
        this.outputLevel = engine.getSettings().getOutputLevel();
    }

    /**
     * Run the analysis to a fixed point
     */
    public void run() {
        dataflow();
    }

    @Override
    protected FlowDomain initialState() {
        FlowDomain s = new FlowDomain(placeInfo.getPlaceDomain(), placeInfo.getLocationDomain());
        for (int arg = 1; arg <= body.getArgCount(); arg++) {
            Location l = Location.argument(arg);
            for (Place p : placeInfo.getArgumentPlaces(arg)) {
                s.insert(placeInfo.normalize(p), l);
            }
        }
        initial = s.copy();
        return s;
    }

    @Override
    protected void flowStatement(FlowDomain state, Statement s, Location loc) {
        apply(state, visitor.visitStatement(s), loc);
    }

    @Override
    protected void flowTerminator(FlowDomain state, Terminator t, Location loc) {
        if (t.getKind() == Terminator.Kind.CALL) {
            List<Mutation> muts = callMutations.get(loc);
            if (muts == null) {
                muts = computeCallMutations(t, loc);
                callMutations.put(loc, muts);
            }
            apply(state, muts, loc);
        }
    }

    /**
     * Every growth of a state adds at least one location to the row of one
     * place
     */
    @Override
    protected long latticeHeight() {
        return (long) placeInfo.getPlaceDomain().size() * placeInfo.getLocationDomain().size();
    }

    /**
     * Fold mutations performed together at one location into the state. The
     * dependencies of every mutation are read before any is written.
     *
     * @param state
     *            state before the location, modified in place
     * @param mutations
     *            mutations of the location
     * @param loc
     *            location
     */
    void apply(FlowDomain state, List<Mutation> mutations, Location loc) {
        if (mutations.isEmpty()) {
            return;
        }
        IndexSet<Location> control = controlDependenciesAt(state, loc);
        List<IndexSet<Location>> allDeps = new ArrayList<>(mutations.size());
        for (Mutation m : mutations) {
            IndexSet<Location> deps = state.emptyLocationSet();
            deps.insert(loc);
            for (Place input : m.getInputs()) {
                deps.union(readDependencies(state, input));
            }
            allDeps.add(deps);
        }

        for (int i = 0; i < mutations.size(); i++) {
            Mutation m = mutations.get(i);
            IndexSet<Location> data = allDeps.get(i);
            IndexSet<Location> deps = data.copy();
            deps.union(control);
            Place mutated = placeInfo.normalize(m.getMutated());
            if (m.getStatus() == MutationStatus.DEFINITE && !mutated.isIndirect()) {
                for (Place child : placeInfo.children(mutated)) {
                    state.clearRow(child);
                }
            }
            for (Place alias : placeInfo.aliases(mutated, Mutability.MUT)) {
                for (Place conflict : placeInfo.conflicts(alias)) {
                    state.unionIntoRow(conflict, deps);
                }
            }
            record(loc, m, data, control);
            if (outputLevel >= 4) {
                System.err.println("\t" + loc + " " + m + " deps " + deps);
            }
        }
    }

    /**
     * Locations the value of a place depends on: the rows of every place
     * overlapping an alias of a value reachable from the place
     *
     * @param state
     *            current state
     * @param place
     *            place being read
     * @return a fresh set of locations
     */
    IndexSet<Location> readDependencies(FlowDomain state, Place place) {
        IndexSet<Location> deps = state.emptyLocationSet();
        for (Place reachable : placeInfo.reachableValues(place, Mutability.NOT)) {
            for (Place alias : placeInfo.aliases(reachable, Mutability.NOT)) {
                for (Place conflict : placeInfo.conflicts(alias)) {
                    deps.union(state.rowSet(conflict));
                }
            }
        }
        return deps;
    }

    private IndexSet<Location> controlDependenciesAt(FlowDomain state, Location loc) {
        IndexSet<Location> s = state.emptyLocationSet();
        if (controlDependencies == null || loc.isArgument()) {
            return s;
        }
        for (int controller : controlDependencies.getControllers(loc.getBlock())) {
            s.insert(body.getTerminatorLocation(controller));
            Terminator t = body.getBlock(controller).getTerminator();
            if (t.getKind() == Terminator.Kind.SWITCH_INT && t.getDiscriminant().getPlace() != null) {
                s.union(readDependencies(state, t.getDiscriminant().getPlace()));
            }
        }
        return s;
    }

    private void record(Location loc, Mutation m, IndexSet<Location> data, IndexSet<Location> control) {
        List<MutationRecord> atLoc = records.get(loc);
        if (atLoc == null) {
            atLoc = new ArrayList<>();
            records.put(loc, atLoc);
        }
        for (MutationRecord r : atLoc) {
            Mutation existing = r.getMutation();
            if (existing.getMutated().equals(m.getMutated()) && existing.getReason().equals(m.getReason())) {
                r.merge(data, control);
                return;
            }
        }
        atLoc.add(new MutationRecord(loc, m, data, control));
    }

    /**
     * Decide how a call is treated and compute the mutations it performs
     */
    private List<Mutation> computeCallMutations(Terminator call, Location loc) {
        ProcedureId callee = call.getStaticCallee();
        List<Type> instantiation = call.getFunction().getInstantiation();
        Map<String, String> metadata = Collections.emptyMap();
        boolean unwrapped = false;
        Terminator effective = call;

        if (call.getFunction().getKind() == Operand.Kind.FUNCTION) {
            ProcedureId named = call.getFunction().getFunction();
            Procedure calleeBody = engine.getProgram().getBody(named);
            CallInfo info = new CallInfo(body.getId(), loc, named, instantiation,
                                         call.getFunction().isDynamic(), AsyncWrappers.isAsyncWrapper(calleeBody));
            CallChanges changes = engine.getCallback().onCall(info);
            metadata = changes.getMetadata();
            SkipCall skip = changes.getSkip();
            if (outputLevel >= 2) {
                System.err.println("CALL " + info + ": " + changes);
            }
            switch (skip.getKind()) {
            case SKIP_WITH_EFFECTS:
                recordCall(new CallRecord(loc, named, instantiation, CallOutcome.SKIPPED_WITH_EFFECTS, false,
                                          metadata, null));
                return fakeEffectMutations(call, skip.getFakeEffects());
            case SKIP_OPAQUE:
                recordCall(new CallRecord(loc, named, instantiation, CallOutcome.SKIPPED_OPAQUE, false, metadata,
                                          null));
                return visitor.opaqueCall(call);
            case UNWRAP:
                Terminator inner = AsyncWrappers.forwardedCall(calleeBody);
                if (inner != null && !call.getFunction().isDynamic()) {
                    callee = inner.getStaticCallee();
                    instantiation = inner.getFunction().getInstantiation();
                    unwrapped = true;
                    // same arguments and destination, different callee
                    effective = Terminator.call(inner.getFunction(), call.getArgs(), call.getDestination(),
                                                call.getTargets().isEmpty() ? null : call.getTargets().get(0),
                                                call.getCleanup());
                }
                break;
            case NO_SKIP:
                break;
            default:
                throw new RuntimeException("Unknown call decision " + skip);
            }
        }

        RecursiveCallInliner.Result r = engine.getInliner().inline(body, effective, callee, instantiation);
        ProcedureId recorded = callee == null && call.getFunction().getKind() == Operand.Kind.FUNCTION ? call
                .getFunction().getFunction() : callee;
        recordCall(new CallRecord(loc, recorded, instantiation, r.getOutcome(), unwrapped, metadata,
                                  r.getCalleeResults()));
        if (r.getMutations() == null) {
            return visitor.opaqueCall(call);
        }
        return r.getMutations();
    }

    private void recordCall(CallRecord r) {
        callRecords.put(r.getLocation(), r);
        if (r.getOutcome().isConservative()) {
            engine.getScopeReport().recordConservative(body.getId(), r);
        }
    }

    /**
     * Mutations described by the fake effects of a skipped call
     */
    private List<Mutation> fakeEffectMutations(Terminator call, List<FakeEffect> effects) {
        List<Place> reads = new ArrayList<>();
        for (FakeEffect e : effects) {
            if (e.getKind() == FakeEffectKind.READ) {
                Place p = toCaller(call, e.getPlace());
                if (p != null) {
                    reads.add(p);
                }
            }
        }
        List<Mutation> l = new ArrayList<>();
        l.add(new Mutation(call.getDestination(), reads, MutationReason.CALL_RETURN, MutationStatus.DEFINITE));
        for (FakeEffect e : effects) {
            int local = e.getPlace().getLocal();
            if (e.getKind() != FakeEffectKind.WRITE || local == 0) {
                continue;
            }
            Place p = toCaller(call, e.getPlace());
            if (p != null) {
                l.add(new Mutation(p, reads, MutationReason.callArgument(local - 1), MutationStatus.POSSIBLE));
            }
        }
        return l;
    }

    /**
     * Rewrite a place stated on the callee's locals onto the call's
     * destination or actual argument
     */
    private static Place toCaller(Terminator call, Place calleePlace) {
        int local = calleePlace.getLocal();
        Place root;
        if (local == 0) {
            root = call.getDestination();
        }
        else if (local <= call.getArgs().size()) {
            root = call.getArgs().get(local - 1).getPlace();
        }
        else {
            throw new IllegalArgumentException("Fake effect on " + calleePlace + " but the call has only "
                    + call.getArgs().size() + " arguments");
        }
        if (root == null) {
            return null;
        }
        List<ProjectionElem> proj = new ArrayList<>(root.getProjection());
        proj.addAll(calleePlace.getProjection());
        return Place.make(root.getLocal(), proj);
    }

    /**
     * @return state on entry to the procedure
     */
    public FlowDomain getInitialState() {
        return initial;
    }

    public PlaceInfo getPlaceInfo() {
        return placeInfo;
    }

    public Collection<MutationRecord> getMutationRecords() {
        List<MutationRecord> all = new ArrayList<>();
        for (List<MutationRecord> atLoc : records.values()) {
            all.addAll(atLoc);
        }
        return Collections.unmodifiableList(all);
    }

    public Map<Location, CallRecord> getCallRecords() {
        return Collections.unmodifiableMap(callRecords);
    }
}
