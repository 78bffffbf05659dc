package analysis.dataflow.interprocedural.infoflow;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

import analysis.dataflow.interprocedural.pdg.CallChangeCallback;
import analysis.dataflow.interprocedural.pdg.UnwrapAsyncCallback;
import analysis.ir.AliasOracle;
import analysis.ir.AliasOracleFactory;
import analysis.ir.Procedure;
import analysis.ir.ProcedureId;
import analysis.ir.ProgramRepository;
import analysis.ir.TypeOracle;

/**
 * Manages the dependency analysis of a procedure and, recursively, of the
 * procedures it calls. Results are cached per procedure for the lifetime of
 * this object, and a procedure is never analyzed while its own analysis is in
 * progress. Create one instance per query; instances are not thread-safe.
 */
public class InterproceduralInfoFlow {

    private final ProgramRepository program;
    private final TypeOracle types;
    private final AliasOracleFactory aliasFactory;
    private final InfoFlowSettings settings;
    private final CallChangeCallback callback;
    private final RecursiveCallInliner inliner;
    /**
     * Results for every procedure analyzed so far
     */
    private final Map<ProcedureId, FlowResults> recordedResults = new LinkedHashMap<>();
    /**
     * Procedures whose analysis is in progress, innermost first
     */
    private final Deque<ProcedureId> currentlyProcessing = new ArrayDeque<>();
    private final ScopeReport scopeReport = new ScopeReport();

    /**
     * @param program
     *            bodies and signatures
     * @param types
     *            type oracle
     * @param aliasFactory
     *            alias analysis to run on each body
     * @param settings
     *            analysis options
     * @param callback
     *            call policy, null for {@link UnwrapAsyncCallback}
     */
    public InterproceduralInfoFlow(ProgramRepository program, TypeOracle types, AliasOracleFactory aliasFactory,
                                   InfoFlowSettings settings, CallChangeCallback callback) {
        this.program = program;
        this.types = types;
        this.aliasFactory = aliasFactory;
        this.settings = settings;
        this.callback = callback == null ? new UnwrapAsyncCallback() : callback;
        this.inliner = new RecursiveCallInliner(this);
    }

    /**
     * Compute the dependency relation of a procedure
     *
     * @param id
     *            procedure with a body in the program
     * @return the results, shared with every other request for the procedure
     * @throws IllegalArgumentException
     *             if the procedure has no body
     */
    public FlowResults computeFlow(ProcedureId id) {
        Procedure body = program.getBody(id);
        if (body == null) {
            throw new IllegalArgumentException("No body for " + id);
        }
        return computeFlow(body);
    }

    /**
     * Compute the dependency relation of a procedure body
     *
     * @param body
     *            procedure body
     * @return the results, shared with every other request for the procedure
     */
    public FlowResults computeFlow(Procedure body) {
        ProcedureId id = body.getId();
        FlowResults results = recordedResults.get(id);
        if (results != null) {
            return results;
        }
        if (currentlyProcessing.contains(id)) {
            throw new IllegalStateException("Recursive request for " + id + " while analyzing "
                    + currentlyProcessing);
        }

        currentlyProcessing.push(id);
        try {
            if (settings.getOutputLevel() >= 1) {
                System.err.println(indent() + "ANALYZING " + id);
            }
            long start = System.currentTimeMillis();
            AliasOracle aliases = aliasFactory.build(body, types);
            PlaceInfo placeInfo = new PlaceInfo(body, aliases, types, settings.getMaxPlaceDepth());
            FlowAnalysis analysis = new FlowAnalysis(this, placeInfo);
            analysis.run();
            placeInfo.freeze();
            results = new FlowResults(analysis);
            recordedResults.put(id, results);
            if (settings.getOutputLevel() >= 1) {
                System.err.println(indent() + "FINISHED " + id + " in " + (System.currentTimeMillis() - start)
                        + "ms, " + placeInfo.getPlaceDomain().size() + " places");
            }
            if (settings.getOutputLevel() >= 3) {
                System.err.println(indent() + "EXIT SUMMARY " + results.getExitSummary());
            }
        }
        finally {
            currentlyProcessing.pop();
        }
        return results;
    }

    private String indent() {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < currentlyProcessing.size(); i++) {
            sb.append("  ");
        }
        return sb.toString();
    }

    /**
     * @param id
     *            procedure
     * @return true if the procedure's analysis is in progress
     */
    public boolean isBeingAnalyzed(ProcedureId id) {
        return currentlyProcessing.contains(id);
    }

    /**
     * @return results computed so far, by procedure
     */
    public Map<ProcedureId, FlowResults> getRecordedResults() {
        return Collections.unmodifiableMap(recordedResults);
    }

    public ProgramRepository getProgram() {
        return program;
    }

    public TypeOracle getTypes() {
        return types;
    }

    public InfoFlowSettings getSettings() {
        return settings;
    }

    public CallChangeCallback getCallback() {
        return callback;
    }

    RecursiveCallInliner getInliner() {
        return inliner;
    }

    /**
     * @return conservative treatments applied so far
     */
    public ScopeReport getScopeReport() {
        return scopeReport;
    }
}
