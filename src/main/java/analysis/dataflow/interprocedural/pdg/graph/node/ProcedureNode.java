package analysis.dataflow.interprocedural.pdg.graph.node;

import java.io.Writer;

import org.json.JSONException;
import org.json.JSONObject;

import analysis.dataflow.interprocedural.infoflow.FlowResults;
import analysis.dataflow.interprocedural.pdg.serialization.JSONSerializable;
import analysis.dataflow.interprocedural.pdg.serialization.JSONUtil;

/**
 * Node in a dependence graph for one procedure in one context. Nodes for calls
 * that were skipped by the call policy are not analyzed and have no results.
 */
public final class ProcedureNode implements JSONSerializable {

    /**
     * Index of the node in its graph
     */
    private final int id;
    private final DependenceNodeKey key;
    /**
     * null if the node was not analyzed
     */
    private FlowResults results;

    /**
     * Create a node, nodes are created by the graph
     *
     * @param id
     *            index of the node in its graph
     * @param key
     *            procedure, instantiation and context
     * @param results
     *            dependency relation of the procedure, null if it was not
     *            analyzed
     */
    public ProcedureNode(int id, DependenceNodeKey key, FlowResults results) {
        this.id = id;
        this.key = key;
        this.results = results;
    }

    public int getId() {
        return id;
    }

    public DependenceNodeKey getKey() {
        return key;
    }

    /**
     * @return true if the body of the procedure was analyzed
     */
    public boolean isAnalyzed() {
        return results != null;
    }

    /**
     * @return dependency relation of the procedure, null if it was not
     *         analyzed
     */
    public FlowResults getResults() {
        return results;
    }

    /**
     * Record the results of a node first created for a skipped call and later
     * reached by an analyzed one
     *
     * @param flow
     *            dependency relation of the procedure
     * @throws IllegalStateException
     *             if the node already has results
     */
    public void attachResults(FlowResults flow) {
        if (results != null) {
            throw new IllegalStateException(key + " was already analyzed");
        }
        this.results = flow;
    }

    /**
     * Name of the group this node is printed in for dot output
     *
     * @return name of to group this node under
     */
    public String groupingName() {
        return key.getProcedure().toString();
    }

    /**
     * Pointer equality
     * <p>
     * {@inheritDoc}
     */
    @Override
    public boolean equals(Object obj) {
        return this == obj;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return key.toString();
    }

    @Override
    public JSONObject toJSON() {
        return JSONUtil.toJSON(this);
    }

    @Override
    public void writeJSON(Writer out) throws JSONException {
        toJSON().write(out);
    }
}
