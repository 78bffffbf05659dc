package analysis.dataflow.interprocedural.pdg;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import analysis.dataflow.interprocedural.infoflow.CallOutcome;
import analysis.dataflow.interprocedural.infoflow.CallRecord;
import analysis.dataflow.interprocedural.infoflow.FlowResults;
import analysis.dataflow.interprocedural.infoflow.InterproceduralInfoFlow;
import analysis.dataflow.interprocedural.infoflow.MutationRecord;
import analysis.dataflow.interprocedural.infoflow.ScopeReport;
import analysis.dataflow.interprocedural.pdg.graph.CallSiteLabel;
import analysis.dataflow.interprocedural.pdg.graph.DependenceEdgeType;
import analysis.dataflow.interprocedural.pdg.graph.DependenceGraph;
import analysis.dataflow.interprocedural.pdg.graph.GraphLocation;
import analysis.dataflow.interprocedural.pdg.graph.node.DependenceNodeKey;
import analysis.dataflow.interprocedural.pdg.graph.node.ProcedureNode;
import analysis.ir.Location;
import analysis.ir.Procedure;
import analysis.ir.ProcedureId;

/**
 * Builds the dependence graph of a root procedure and of every procedure the
 * dependency analysis recursed into from it. Each node's edges come from the
 * mutation witnesses and call records of its procedure's dependency relation.
 */
public class DependenceGraphConstructor {

    private final DependenceGraphParams params;
    private final InterproceduralInfoFlow engine;
    private final int outputLevel;

    public DependenceGraphConstructor(DependenceGraphParams params) {
        this.params = params;
        this.engine = new InterproceduralInfoFlow(params.getProgram(), params.getTypes(), params.getAliasFactory(),
                                                  params.getSettings(), params.getCallback());
        this.outputLevel = params.getSettings().getOutputLevel();
    }

    /**
     * Compute the dependence graph of the root procedure
     *
     * @return the frozen graph
     * @throws IllegalArgumentException
     *             if the root has no body in the program
     */
    public DependenceGraph construct() {
        long start = System.currentTimeMillis();
        DependenceGraph g = new DependenceGraph();
        CallContextSelector selector = params.getContextSelector();

        FlowResults rootResults = engine.computeFlow(params.getRoot());
        ProcedureNode root = g.getOrCreateNode(new DependenceNodeKey(params.getRoot(), params.getRootInstantiation(),
                                                                     selector.initialContext()), rootResults);

        Deque<ProcedureNode> q = new ArrayDeque<>();
        Set<ProcedureNode> visited = new HashSet<>();
        q.push(root);
        while (!q.isEmpty()) {
            ProcedureNode n = q.pop();
            if (!visited.add(n)) {
                continue;
            }
            if (outputLevel >= 2) {
                System.err.println("PDG NODE " + n);
            }
            addIntraproceduralEdges(g, n);
            for (CallRecord call : n.getResults().getCallRecords().values()) {
                ProcedureNode callee = processCall(g, n, call);
                if (callee != null && callee.isAnalyzed() && !visited.contains(callee)) {
                    q.push(callee);
                }
            }
        }

        g.freeze();
        if (outputLevel >= 1) {
            System.err.println("Dependence graph for " + params.getRoot() + " built in "
                    + (System.currentTimeMillis() - start) + "ms");
            g.printSimpleCounts();
        }
        return g;
    }

    /**
     * Add data and control edges for every mutation witness of an analyzed
     * node
     */
    private static void addIntraproceduralEdges(DependenceGraph g, ProcedureNode n) {
        for (MutationRecord r : n.getResults().getMutationRecords()) {
            Location at = r.getLocation();
            GraphLocation target = new GraphLocation(n, at);
            for (Location d : r.getDataDependencies()) {
                if (!d.equals(at)) {
                    g.addEdge(new GraphLocation(n, d), target, DependenceEdgeType.DATA, r.getMutation().getMutated(),
                              r.getMutation().getReason(), null);
                }
            }
            for (Location c : r.getControlDependencies()) {
                if (!c.equals(at)) {
                    g.addEdge(new GraphLocation(n, c), target, DependenceEdgeType.CONTROL, r.getMutation()
                            .getMutated(), r.getMutation().getReason(), null);
                }
            }
        }
    }

    /**
     * Record a call site, creating the callee's node and the edges crossing the
     * call if the callee was analyzed
     *
     * @return the callee's node, null if the call has none
     */
    private ProcedureNode processCall(DependenceGraph g, ProcedureNode caller, CallRecord call) {
        GraphLocation site = new GraphLocation(caller, call.getLocation());
        ProcedureId callee = call.getCallee();
        CallOutcome outcome = call.getOutcome();
        boolean skipped = outcome == CallOutcome.SKIPPED_OPAQUE || outcome == CallOutcome.SKIPPED_WITH_EFFECTS;
        if (callee == null || !(outcome == CallOutcome.RECURSED || skipped)) {
            g.addCallSite(new CallSiteLabel(site, call, null));
            return null;
        }

        ProcedureId callerId = caller.getKey().getProcedure();
        CallContext context = params.getContextSelector().merge(caller.getKey().getContext(), callerId,
                                                                call.getLocation(), callee);
        DependenceNodeKey key = new DependenceNodeKey(callee, call.getInstantiation(), context);
        FlowResults results = call.getCalleeResults();
        ProcedureNode calleeNode = g.getOrCreateNode(key, results);
        if (results != null && !calleeNode.isAnalyzed()) {
            g.attachResults(calleeNode, results);
        }
        CallSiteLabel label = new CallSiteLabel(site, call, calleeNode);
        g.addCallSite(label);
        if (results == null) {
            return calleeNode;
        }

        Procedure body = results.getBody();
        List<Location> all = body.getAllLocations();
        if (body.getArgCount() == 0) {
            if (!all.isEmpty()) {
                g.addEdge(site, new GraphLocation(calleeNode, all.get(0)), DependenceEdgeType.CALL, null, null, label);
            }
        }
        else {
            for (int arg = 1; arg <= body.getArgCount(); arg++) {
                g.addEdge(site, new GraphLocation(calleeNode, Location.argument(arg)), DependenceEdgeType.CALL, null,
                          null, label);
            }
        }
        for (Location ret : body.getReturnLocations()) {
            g.addEdge(new GraphLocation(calleeNode, ret), site, DependenceEdgeType.RETURN, null, null, label);
        }
        return calleeNode;
    }

    /**
     * @return the dependency engine used for the construction
     */
    public InterproceduralInfoFlow getEngine() {
        return engine;
    }

    /**
     * @return conservative treatments applied while building the graph
     */
    public ScopeReport getScopeReport() {
        return engine.getScopeReport();
    }
}
