package analysis.dataflow.interprocedural.infoflow;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import util.indexed.IndexMatrix;
import util.indexed.IndexSet;
import util.indexed.IndexedDomain;
import analysis.dataflow.util.AbstractValue;
import analysis.ir.Location;
import analysis.ir.Place;

/**
 * Flow state: for each place, the locations whose values may have influenced
 * the current value of the place
 */
public class FlowDomain implements AbstractValue<FlowDomain> {

    private final IndexMatrix<Place, Location> matrix;

    /**
     * Create an empty state
     *
     * @param places
     *            place domain of the procedure
     * @param locations
     *            location domain of the procedure
     */
    public FlowDomain(IndexedDomain<Place> places, IndexedDomain<Location> locations) {
        this.matrix = new IndexMatrix<>(places, locations);
    }

    private FlowDomain(IndexMatrix<Place, Location> matrix) {
        this.matrix = matrix;
    }

    /**
     * @param place
     *            place
     * @return locations the place depends on, must not be modified
     */
    public IndexSet<Location> rowSet(Place place) {
        return matrix.rowSet(place);
    }

    public boolean insert(Place place, Location loc) {
        return matrix.insert(place, loc);
    }

    public boolean unionIntoRow(Place place, IndexSet<Location> locs) {
        return matrix.unionIntoRow(place, locs);
    }

    public boolean clearRow(Place place) {
        return matrix.clearRow(place);
    }

    /**
     * @return places with at least one dependency
     */
    public List<Place> rows() {
        return matrix.rows();
    }

    /**
     * @return a fresh empty set of locations over this state's domain
     */
    public IndexSet<Location> emptyLocationSet() {
        return new IndexSet<>(matrix.getColumnDomain());
    }

    @Override
    public boolean leq(FlowDomain that) {
        return matrix.leq(that.matrix);
    }

    @Override
    public boolean isBottom() {
        return matrix.isEmpty();
    }

    @Override
    public boolean join(FlowDomain that) {
        return matrix.join(that.matrix);
    }

    @Override
    public FlowDomain copy() {
        return new FlowDomain(matrix.copy());
    }

    /**
     * @return the relation as a map, comparable across procedures and engines
     */
    public Map<Place, Set<Location>> toMap() {
        Map<Place, Set<Location>> m = new LinkedHashMap<>();
        for (Place p : rows()) {
            m.put(p, new LinkedHashSet<>(rowSet(p).elements()));
        }
        return m;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof FlowDomain && matrix.equals(((FlowDomain) obj).matrix);
    }

    @Override
    public int hashCode() {
        return matrix.hashCode();
    }

    @Override
    public String toString() {
        return matrix.toString();
    }
}
