package analysis.dataflow.interprocedural.infoflow;

import util.indexed.IndexSet;
import analysis.ir.Location;

/**
 * Witness of a mutation applied at a location: the locations its new value
 * depends on, accumulated over every time the location was analyzed
 */
public final class MutationRecord {

    private final Location location;
    private final Mutation mutation;
    private final IndexSet<Location> dataDependencies;
    private final IndexSet<Location> controlDependencies;

    MutationRecord(Location location, Mutation mutation, IndexSet<Location> data, IndexSet<Location> control) {
        this.location = location;
        this.mutation = mutation;
        this.dataDependencies = data.copy();
        this.controlDependencies = control.copy();
    }

    void merge(IndexSet<Location> data, IndexSet<Location> control) {
        dataDependencies.union(data);
        controlDependencies.union(control);
    }

    public Location getLocation() {
        return location;
    }

    public Mutation getMutation() {
        return mutation;
    }

    /**
     * @return locations whose values flow into the mutated place, including
     *         the mutation's own location
     */
    public IndexSet<Location> getDataDependencies() {
        return dataDependencies;
    }

    /**
     * @return locations deciding whether the mutation executes
     */
    public IndexSet<Location> getControlDependencies() {
        return controlDependencies;
    }

    @Override
    public String toString() {
        return location + ": " + mutation + " data " + dataDependencies + " control " + controlDependencies;
    }
}
