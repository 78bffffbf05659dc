package unit;

import static unit.ExamplePrograms.loc;
import static unit.ExamplePrograms.local;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import junit.framework.TestCase;

import org.json.JSONArray;
import org.json.JSONObject;

import analysis.dataflow.interprocedural.infoflow.CallOutcome;
import analysis.dataflow.interprocedural.infoflow.FlowResults;
import analysis.dataflow.interprocedural.pdg.CallChangeCallback;
import analysis.dataflow.interprocedural.pdg.CallChanges;
import analysis.dataflow.interprocedural.pdg.CallInfo;
import analysis.dataflow.interprocedural.pdg.CallSiteSensitive;
import analysis.dataflow.interprocedural.pdg.DependenceGraphConstructor;
import analysis.dataflow.interprocedural.pdg.DependenceGraphParams;
import analysis.dataflow.interprocedural.pdg.FakeEffect;
import analysis.dataflow.interprocedural.pdg.SkipCall;
import analysis.dataflow.interprocedural.pdg.SkipProceduresCallback;
import analysis.dataflow.interprocedural.pdg.UnwrapAsyncCallback;
import analysis.dataflow.interprocedural.pdg.graph.CallSiteLabel;
import analysis.dataflow.interprocedural.pdg.graph.DependenceEdge;
import analysis.dataflow.interprocedural.pdg.graph.DependenceEdgeType;
import analysis.dataflow.interprocedural.pdg.graph.DependenceGraph;
import analysis.dataflow.interprocedural.pdg.graph.GraphLocation;
import analysis.dataflow.interprocedural.pdg.graph.node.ProcedureNode;
import analysis.ir.InMemoryProgram;
import analysis.ir.Location;
import analysis.ir.ProcedureId;
import analysis.ir.StructuralTypeOracle;

public class TestDependenceGraphConstructor extends TestCase {

    private static final ProcedureId HELPER = ProcedureId.parse("m::helper");

    private static DependenceGraphParams params(InMemoryProgram program, ProcedureId root) {
        return new DependenceGraphParams(program, new StructuralTypeOracle(), root);
    }

    private static DependenceGraph build(DependenceGraphParams params) {
        return new DependenceGraphConstructor(params).construct();
    }

    private static ProcedureNode nodeFor(DependenceGraph g, ProcedureId id) {
        for (ProcedureNode n : g.getNodes()) {
            if (n.getKey().getProcedure().equals(id)) {
                return n;
            }
        }
        return null;
    }

    public void testCallAndReturnEdges() {
        DependenceGraph g = build(params(ExamplePrograms.firstOfTwo(), ExamplePrograms.MAIN));
        assertTrue(g.isFrozen());
        assertEquals(2, g.numNodes());
        assertEquals(ExamplePrograms.MAIN, g.getRoot().getKey().getProcedure());

        ProcedureNode first = nodeFor(g, ProcedureId.parse("m::first"));
        assertNotNull(first);
        assertTrue(first.isAnalyzed());

        GraphLocation site = new GraphLocation(g.getRoot(), loc(0, 2));
        Set<GraphLocation> callTargets = new HashSet<>();
        for (DependenceEdge e : g.getEdges(DependenceEdgeType.CALL)) {
            assertEquals(site, e.getSource());
            assertNotNull(e.getLabel());
            callTargets.add(e.getTarget());
        }
        Set<GraphLocation> expected = new HashSet<>();
        expected.add(new GraphLocation(first, Location.argument(1)));
        expected.add(new GraphLocation(first, Location.argument(2)));
        assertEquals(expected, callTargets);

        Set<DependenceEdge> returns = g.getEdges(DependenceEdgeType.RETURN);
        assertEquals(first.getResults().getBody().getReturnLocations().size(), returns.size());
        for (DependenceEdge e : returns) {
            assertSame(first, e.getSource().getNode());
            assertEquals(site, e.getTarget());
        }
    }

    public void testDataEdgesWithinANode() {
        DependenceGraph g = build(params(ExamplePrograms.twoCallsToHelper(), ExamplePrograms.MAIN));
        GraphLocation arg = new GraphLocation(g.getRoot(), Location.argument(1));
        GraphLocation firstCall = new GraphLocation(g.getRoot(), loc(0, 0));
        GraphLocation secondCall = new GraphLocation(g.getRoot(), loc(1, 0));

        Set<GraphLocation> sources = new HashSet<>();
        for (DependenceEdge e : g.getIncomingEdges(secondCall)) {
            if (e.getType() == DependenceEdgeType.DATA) {
                assertEquals(local(0), e.getPlace());
                sources.add(e.getSource());
            }
        }
        Set<GraphLocation> expected = new HashSet<>();
        expected.add(arg);
        expected.add(firstCall);
        assertEquals(expected, sources);

        for (DependenceEdge e : g.getEdges(DependenceEdgeType.DATA)) {
            assertFalse(e.getSource().equals(e.getTarget()));
        }
    }

    public void testContextInsensitiveSharesCalleeNode() {
        DependenceGraph g = build(params(ExamplePrograms.twoCallsToHelper(), ExamplePrograms.MAIN));
        assertEquals(2, g.numNodes());
        assertEquals(2, g.getCallSites().size());
        ProcedureNode helper = nodeFor(g, HELPER);
        for (CallSiteLabel l : g.getCallSites()) {
            assertSame(helper, l.getCalleeNode());
            assertEquals(CallOutcome.RECURSED, l.getOutcome());
        }
        assertEquals(2, g.getEdges(DependenceEdgeType.CALL).size());
        assertEquals(2, g.getEdges(DependenceEdgeType.RETURN).size());
    }

    public void testCallSiteSensitiveSplitsCalleeNode() {
        DependenceGraph g = build(params(ExamplePrograms.twoCallsToHelper(), ExamplePrograms.MAIN)
                .setContextSelector(new CallSiteSensitive(1)));
        assertEquals(3, g.numNodes());
        int helpers = 0;
        for (ProcedureNode n : g.getNodes()) {
            if (n.getKey().getProcedure().equals(HELPER)) {
                helpers++;
                assertEquals(1, n.getKey().getContext().size());
                assertTrue(n.isAnalyzed());
            }
        }
        assertEquals(2, helpers);
    }

    public void testSkippedProcedureHasUnanalyzedNode() {
        DependenceGraph g = build(params(ExamplePrograms.twoCallsToHelper(), ExamplePrograms.MAIN)
                .setCallback(new SkipProceduresCallback(Collections.singleton(HELPER), new UnwrapAsyncCallback())));
        assertEquals(2, g.numNodes());
        ProcedureNode helper = nodeFor(g, HELPER);
        assertFalse(helper.isAnalyzed());
        for (CallSiteLabel l : g.getCallSites()) {
            assertEquals(CallOutcome.SKIPPED_OPAQUE, l.getOutcome());
            assertEquals("command line", l.getMetadata().get("skipped"));
            assertSame(helper, l.getCalleeNode());
        }
        assertTrue(g.getEdges(DependenceEdgeType.CALL).isEmpty());
        assertTrue(g.getEdges(DependenceEdgeType.RETURN).isEmpty());
    }

    public void testSkipWithEffectsIsNotConservative() {
        CallChangeCallback readFirstArg = new CallChangeCallback() {
            @Override
            public CallChanges onCall(CallInfo info) {
                if (info.getCallee().equals(HELPER)) {
                    FakeEffect readArg = FakeEffect.read(local(1));
                    return new CallChanges(SkipCall.skipWithEffects(Collections.singletonList(readArg)));
                }
                return CallChanges.proceed();
            }
        };
        DependenceGraphParams p = params(ExamplePrograms.twoCallsToHelper(), ExamplePrograms.MAIN);
        DependenceGraphConstructor c = new DependenceGraphConstructor(p.setCallback(readFirstArg));
        DependenceGraph g = c.construct();
        assertTrue(c.getScopeReport().isPrecise());
        for (CallSiteLabel l : g.getCallSites()) {
            assertEquals(CallOutcome.SKIPPED_WITH_EFFECTS, l.getOutcome());
        }

        FlowResults main = g.getRoot().getResults();
        Set<Location> expected = new HashSet<>();
        expected.add(loc(1, 0));
        expected.add(loc(0, 0));
        expected.add(Location.argument(1));
        assertEquals(expected, main.dependenciesOf(local(0), loc(2, 0)));
    }

    public void testAsyncWrapperIsUnwrapped() {
        DependenceGraph g = build(params(ExamplePrograms.asyncWrapper(), ExamplePrograms.MAIN));
        assertEquals(1, g.getCallSites().size());
        CallSiteLabel l = g.getCallSites().get(0);
        assertTrue(l.isUnwrapped());
        assertEquals(ProcedureId.parse("m::work"), l.getCallee());
        assertNull(nodeFor(g, ProcedureId.parse("m::wrapper")));
        assertNotNull(nodeFor(g, ProcedureId.parse("m::work")));
    }

    public void testRecursionTerminates() {
        DependenceGraph g = build(params(ExamplePrograms.selfRecursive(), ProcedureId.parse("m::fact")));
        assertEquals(1, g.numNodes());
        assertEquals(CallOutcome.OPAQUE_RECURSIVE, g.getCallSites().get(0).getOutcome());
        assertNull(g.getCallSites().get(0).getCalleeNode());
    }

    public void testFrozenGraphRejectsChanges() {
        DependenceGraph g = build(params(ExamplePrograms.firstOfTwo(), ExamplePrograms.MAIN));
        GraphLocation a = new GraphLocation(g.getRoot(), loc(0, 0));
        GraphLocation b = new GraphLocation(g.getRoot(), loc(0, 1));
        try {
            g.addEdge(a, b, DependenceEdgeType.DATA, local(1), null, null);
        }
        catch (IllegalStateException e) {
            try {
                g.getOrCreateNode(g.getRoot().getKey(), null);
            }
            catch (IllegalStateException e2) {
                return;
            }
        }
        fail("Should have thrown exception");
    }

    public void testMissingRootIsRejected() {
        try {
            build(params(ExamplePrograms.callsExternal(), ProcedureId.parse("ext::read")));
        }
        catch (IllegalArgumentException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public void testSlices() {
        DependenceGraph g = build(params(ExamplePrograms.twoCallsToHelper(), ExamplePrograms.MAIN));
        ProcedureNode helper = nodeFor(g, HELPER);
        GraphLocation arg = new GraphLocation(g.getRoot(), Location.argument(1));
        GraphLocation secondCall = new GraphLocation(g.getRoot(), loc(1, 0));

        Set<GraphLocation> backward = g.backwardSlice(secondCall);
        assertTrue(backward.contains(secondCall));
        assertTrue(backward.contains(arg));
        assertTrue(backward.contains(new GraphLocation(g.getRoot(), loc(0, 0))));
        assertTrue(backward.contains(new GraphLocation(helper, loc(0, 1))));

        Set<GraphLocation> forward = g.forwardSlice(arg);
        assertTrue(forward.contains(arg));
        assertTrue(forward.contains(secondCall));
        // through the first call site into the callee
        assertTrue(forward.contains(new GraphLocation(helper, Location.argument(1))));

        Set<GraphLocation> fromSite = g.forwardSlice(new GraphLocation(g.getRoot(), loc(0, 0)));
        assertTrue(fromSite.contains(new GraphLocation(helper, Location.argument(1))));
        assertTrue(fromSite.contains(new GraphLocation(helper, loc(0, 0))));
    }

    public void testJSON() {
        DependenceGraph g = build(params(ExamplePrograms.twoCallsToHelper(), ExamplePrograms.MAIN));
        JSONObject json = g.toJSON();
        JSONArray nodes = json.getJSONArray("nodes");
        JSONArray edges = json.getJSONArray("edges");
        assertEquals(g.numNodes(), nodes.length());
        assertEquals(g.numEdges(), edges.length());
        assertEquals("m::main", nodes.getJSONObject(0).getString("procedure"));
        assertTrue(nodes.getJSONObject(0).getBoolean("analyzed"));

        boolean sawCall = false;
        for (int i = 0; i < edges.length(); i++) {
            JSONObject e = edges.getJSONObject(i);
            assertTrue(e.has("source"));
            assertTrue(e.has("dest"));
            if ("CALL".equals(e.getString("type"))) {
                JSONObject label = e.getJSONObject("label");
                assertEquals("m::helper", label.getString("callee"));
                assertEquals("RECURSED", label.getString("outcome"));
                assertFalse(label.getBoolean("unwrapped"));
                sawCall = true;
            }
            else if ("DATA".equals(e.getString("type"))) {
                assertTrue(e.has("place"));
                assertFalse(e.has("label"));
            }
        }
        assertTrue(sawCall);
    }

    public void testDot() throws IOException {
        DependenceGraph g = build(params(ExamplePrograms.twoCallsToHelper(), ExamplePrograms.MAIN));
        StringWriter w = new StringWriter();
        g.writeDot(w, true, 0.1);
        String dot = w.toString();
        assertTrue(dot.startsWith("digraph G {"));
        assertTrue(dot.contains("cluster_0"));
        assertTrue(dot.contains("cluster_1"));
        assertTrue(dot.contains("->"));
    }
}
