package analysis.dataflow.interprocedural.pdg.graph;

import analysis.dataflow.interprocedural.pdg.graph.node.ProcedureNode;
import analysis.ir.Location;

/**
 * A program point of one node of the dependence graph
 */
public final class GraphLocation {

    private final ProcedureNode node;
    private final Location location;

    public GraphLocation(ProcedureNode node, Location location) {
        assert node != null && location != null;
        this.node = node;
        this.location = location;
    }

    public ProcedureNode getNode() {
        return node;
    }

    public Location getLocation() {
        return location;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof GraphLocation)) {
            return false;
        }
        GraphLocation other = (GraphLocation) obj;
        return node == other.node && location.equals(other.location);
    }

    @Override
    public int hashCode() {
        return 31 * node.hashCode() + location.hashCode();
    }

    @Override
    public String toString() {
        return node + " " + location;
    }
}
