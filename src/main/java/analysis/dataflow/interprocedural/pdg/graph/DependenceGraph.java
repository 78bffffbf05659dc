package analysis.dataflow.interprocedural.pdg.graph;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.json.JSONException;
import org.json.JSONObject;

import util.indexed.IndexedDomain;
import analysis.dataflow.interprocedural.infoflow.FlowResults;
import analysis.dataflow.interprocedural.infoflow.MutationReason;
import analysis.dataflow.interprocedural.pdg.graph.node.DependenceNodeKey;
import analysis.dataflow.interprocedural.pdg.graph.node.ProcedureNode;
import analysis.dataflow.interprocedural.pdg.serialization.JSONSerializable;
import analysis.ir.Place;

/**
 * Dependence graph over the procedures reached from a root procedure. There is
 * one {@link ProcedureNode} per distinct procedure, instantiation and context,
 * and edges connect program points of these nodes. The graph can no longer be
 * modified once it has been frozen.
 */
public class DependenceGraph implements JSONSerializable {

    /**
     * Interned node keys, the index of a key is the id of its node
     */
    private final IndexedDomain<DependenceNodeKey> keys = new IndexedDomain<>();
    /**
     * All nodes, indexed by id
     */
    private final List<ProcedureNode> nodes = new ArrayList<>();
    /**
     * All edges by type
     */
    private final Map<DependenceEdgeType, Set<DependenceEdge>> edges = new LinkedHashMap<>();
    private final Map<GraphLocation, Set<DependenceEdge>> outgoing = new LinkedHashMap<>();
    private final Map<GraphLocation, Set<DependenceEdge>> incoming = new LinkedHashMap<>();
    private final List<CallSiteLabel> callSites = new ArrayList<>();
    private boolean frozen;

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("The dependence graph is frozen");
        }
    }

    /**
     * Get the node for a key, creating it if there is none
     *
     * @param key
     *            procedure, instantiation and context
     * @param results
     *            dependency relation of the procedure, null if it is not
     *            analyzed. Ignored if the node already exists.
     * @return the unique node for the key
     */
    public ProcedureNode getOrCreateNode(DependenceNodeKey key, FlowResults results) {
        checkNotFrozen();
        if (keys.contains(key)) {
            return nodes.get(keys.index(key));
        }
        int id = keys.intern(key);
        assert id == nodes.size();
        ProcedureNode n = new ProcedureNode(id, key, results);
        nodes.add(n);
        return n;
    }

    /**
     * @param key
     *            procedure, instantiation and context
     * @return the node for the key, null if there is none
     */
    public ProcedureNode getNode(DependenceNodeKey key) {
        if (!keys.contains(key)) {
            return null;
        }
        return nodes.get(keys.index(key));
    }

    /**
     * @return node of the root procedure, null if the graph is empty
     */
    public ProcedureNode getRoot() {
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    /**
     * @return all nodes in creation order
     */
    public List<ProcedureNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Add an edge between two program points
     *
     * @param source
     *            source of the edge
     * @param target
     *            target of the edge
     * @param type
     *            type of edge
     * @param place
     *            place written at the target, null for call and return edges
     * @param reason
     *            reason for the write, null for call and return edges
     * @param label
     *            call site crossed by the edge, null for data and control
     *            edges
     * @return true if the edge was not already in the graph
     */
    public boolean addEdge(GraphLocation source, GraphLocation target, DependenceEdgeType type, Place place,
                           MutationReason reason, CallSiteLabel label) {
        checkNotFrozen();
        DependenceEdge e = new DependenceEdge(source, target, type, place, reason, label);
        Set<DependenceEdge> edgesForType = edges.get(type);
        if (edgesForType == null) {
            edgesForType = new LinkedHashSet<>();
            edges.put(type, edgesForType);
        }
        if (!edgesForType.add(e)) {
            return false;
        }
        addToMap(outgoing, source, e);
        addToMap(incoming, target, e);
        return true;
    }

    private static void addToMap(Map<GraphLocation, Set<DependenceEdge>> m, GraphLocation l, DependenceEdge e) {
        Set<DependenceEdge> s = m.get(l);
        if (s == null) {
            s = new LinkedHashSet<>();
            m.put(l, s);
        }
        s.add(e);
    }

    /**
     * Record how a call site was treated
     *
     * @param label
     *            call site label
     */
    public void addCallSite(CallSiteLabel label) {
        checkNotFrozen();
        callSites.add(label);
    }

    /**
     * @return every call site of every analyzed node
     */
    public List<CallSiteLabel> getCallSites() {
        return Collections.unmodifiableList(callSites);
    }

    /**
     * Attach results to a node first created for a skipped call
     *
     * @param n
     *            node of this graph
     * @param results
     *            dependency relation of the procedure
     */
    public void attachResults(ProcedureNode n, FlowResults results) {
        checkNotFrozen();
        assert nodes.get(n.getId()) == n;
        n.attachResults(results);
    }

    /**
     * Prevent any further modification
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * @return all edges grouped by type
     */
    public Set<DependenceEdge> getEdges() {
        Set<DependenceEdge> all = new LinkedHashSet<>();
        for (DependenceEdgeType t : edges.keySet()) {
            all.addAll(edges.get(t));
        }
        return all;
    }

    /**
     * @param type
     *            edge type
     * @return edges of the given type
     */
    public Set<DependenceEdge> getEdges(DependenceEdgeType type) {
        Set<DependenceEdge> s = edges.get(type);
        if (s == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(s);
    }

    public Set<DependenceEdge> getOutgoingEdges(GraphLocation l) {
        Set<DependenceEdge> s = outgoing.get(l);
        return s == null ? Collections.<DependenceEdge> emptySet() : Collections.unmodifiableSet(s);
    }

    public Set<DependenceEdge> getIncomingEdges(GraphLocation l) {
        Set<DependenceEdge> s = incoming.get(l);
        return s == null ? Collections.<DependenceEdge> emptySet() : Collections.unmodifiableSet(s);
    }

    /**
     * Program points that may influence the given point, following edges
     * backwards transitively
     *
     * @param from
     *            start of the slice
     * @return the points in the slice, including the start
     */
    public Set<GraphLocation> backwardSlice(GraphLocation from) {
        return slice(from, incoming, false);
    }

    /**
     * Program points the given point may influence, following edges forwards
     * transitively
     *
     * @param from
     *            start of the slice
     * @return the points in the slice, including the start
     */
    public Set<GraphLocation> forwardSlice(GraphLocation from) {
        return slice(from, outgoing, true);
    }

    private static Set<GraphLocation> slice(GraphLocation from, Map<GraphLocation, Set<DependenceEdge>> adjacency,
                                            boolean forward) {
        Set<GraphLocation> visited = new LinkedHashSet<>();
        Deque<GraphLocation> q = new ArrayDeque<>();
        visited.add(from);
        q.add(from);
        while (!q.isEmpty()) {
            GraphLocation l = q.poll();
            Set<DependenceEdge> es = adjacency.get(l);
            if (es == null) {
                continue;
            }
            for (DependenceEdge e : es) {
                GraphLocation next = forward ? e.getTarget() : e.getSource();
                if (visited.add(next)) {
                    q.add(next);
                }
            }
        }
        return visited;
    }

    /**
     * @return number of edges
     */
    public int numEdges() {
        int num = 0;
        for (DependenceEdgeType t : edges.keySet()) {
            num += edges.get(t).size();
        }
        return num;
    }

    /**
     * @return number of nodes
     */
    public int numNodes() {
        return nodes.size();
    }

    /**
     * Print the number of nodes and edges
     */
    public void printSimpleCounts() {
        String result = "";
        result += numNodes() + " nodes\n";
        result += numEdges() + " edges\n";
        System.err.println(result);
    }

    /**
     * Print the number of nodes and edges, edges by type and the number of
     * nodes that were not analyzed
     */
    public void printDetailedCounts() {
        printSimpleCounts();
        String result = "";
        for (DependenceEdgeType t : edges.keySet()) {
            result += edges.get(t).size() + " edges of type " + t + "\n";
        }
        int unanalyzed = 0;
        for (ProcedureNode n : nodes) {
            if (!n.isAnalyzed()) {
                unanalyzed++;
            }
        }
        result += unanalyzed + " nodes not analyzed\n";
        System.err.println(result);
    }

    /**
     * Write the graph in graphviz dot format. Every program point with an edge
     * is a dot node.
     *
     * @param writer
     *            writer to write to
     * @param cluster
     *            if true then the graph will contain a subgraph for each
     *            procedure node
     * @param spread
     *            separation between nodes in inches
     * @throws IOException
     *             writer issues
     */
    public void writeDot(Writer writer, boolean cluster, double spread) throws IOException {
        writer.write("digraph G {\n" + "nodesep=" + spread + ";\n" + "ranksep=" + spread + ";\n"
                + "graph [fontsize=10]" + ";\n" + "node [fontsize=10]" + ";\n" + "edge [fontsize=10]" + ";\n");

        Map<ProcedureNode, Set<GraphLocation>> byNode = new LinkedHashMap<>();
        for (ProcedureNode n : nodes) {
            byNode.put(n, new LinkedHashSet<GraphLocation>());
        }
        for (DependenceEdge e : getEdges()) {
            byNode.get(e.getSource().getNode()).add(e.getSource());
            byNode.get(e.getTarget().getNode()).add(e.getTarget());
        }

        for (ProcedureNode n : byNode.keySet()) {
            if (cluster) {
                String label = escape(n.toString());
                writer.write("\tsubgraph \"cluster_" + n.getId() + "\"{\n");
                writer.write("\tlabel=\"" + label + "\";\n");
                if (!n.isAnalyzed()) {
                    writer.write("\tstyle=dashed;\n");
                }
            }
            for (GraphLocation l : byNode.get(n)) {
                writer.write("\t\t\"" + dotName(l) + "\" [label=\"" + escape(l.getLocation().toString()) + "\"]\n");
            }
            if (cluster) {
                writer.write("\t}\n"); // subgraph close
            }
        }

        for (DependenceEdge edge : getEdges()) {
            String edgeLabel = "[label=\"" + escape(edge.dotLabel()) + "\"]";
            writer.write("\t\"" + dotName(edge.getSource()) + "\" -> " + "\"" + dotName(edge.getTarget()) + "\" "
                    + edgeLabel + ";\n");
        }

        writer.write("\n};\n");
    }

    private static String dotName(GraphLocation l) {
        return l.getNode().getId() + ":" + l.getLocation();
    }

    private static String escape(String s) {
        return s.replace("\"", "").replace("\\", "\\\\");
    }

    @Override
    public JSONObject toJSON() {
        try (StringWriter sw = new StringWriter()) {
            writeJSON(sw);
            return new JSONObject(sw.toString());
        }
        catch (JSONException | IOException e) {
            throw new RuntimeException("Cannot write JSON: " + e.getMessage(), e);
        }
    }

    @Override
    public void writeJSON(Writer out) throws JSONException {
        try {
            out.write('{');
            out.write("\"nodes\":");
            out.write("[");
            boolean first = true;
            for (ProcedureNode n : this.nodes) {
                if (first) {
                    first = false;
                }
                else {
                    out.write(", ");
                }
                n.writeJSON(out);
            }

            out.write("]");
            out.write(",\n  \"edges\":");
            out.write("[");
            first = true;
            for (DependenceEdgeType t : this.edges.keySet()) {
                for (DependenceEdge e : edges.get(t)) {
                    if (first) {
                        first = false;
                    }
                    else {
                        out.write(", ");
                    }
                    e.writeJSON(out);
                }
            }
            out.write("]");
            out.write("\n}");
        }
        catch (IOException e) {
            throw new JSONException(e);
        }
    }
}
