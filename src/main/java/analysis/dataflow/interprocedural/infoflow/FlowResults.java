package analysis.dataflow.interprocedural.infoflow;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import util.indexed.IndexSet;
import analysis.ir.Location;
import analysis.ir.Place;
import analysis.ir.Procedure;

/**
 * Dependency relation computed for one procedure, at every location
 */
public class FlowResults {

    private final FlowAnalysis analysis;
    /**
     * Join of the states at the return terminators, computed on demand
     */
    private FlowDomain exitSummary;

    FlowResults(FlowAnalysis analysis) {
        this.analysis = analysis;
    }

    public Procedure getBody() {
        return analysis.getBody();
    }

    public PlaceInfo getPlaceInfo() {
        return analysis.getPlaceInfo();
    }

    /**
     * @param loc
     *            location in the procedure, or an argument pseudo-point
     * @return the state after the location, null if the location is
     *         unreachable. Must not be modified.
     */
    public FlowDomain getStateAt(Location loc) {
        if (loc.isArgument()) {
            return analysis.getInitialState();
        }
        return analysis.getStateAfter(loc);
    }

    /**
     * @return the join of the states at every return terminator, empty if the
     *         procedure never returns. Must not be modified.
     */
    public FlowDomain getExitSummary() {
        if (exitSummary == null) {
            PlaceInfo pi = analysis.getPlaceInfo();
            FlowDomain s = new FlowDomain(pi.getPlaceDomain(), pi.getLocationDomain());
            for (Location ret : getBody().getReturnLocations()) {
                FlowDomain atRet = analysis.getStateAfter(ret);
                if (atRet != null) {
                    s.join(atRet);
                }
            }
            exitSummary = s;
        }
        return exitSummary;
    }

    /**
     * @return witnesses for every mutation applied during the analysis
     */
    public Collection<MutationRecord> getMutationRecords() {
        return analysis.getMutationRecords();
    }

    /**
     * @return how each call site was treated
     */
    public Map<Location, CallRecord> getCallRecords() {
        return analysis.getCallRecords();
    }

    /**
     * Locations that may have influenced the value of a place after a location
     *
     * @param place
     *            place of the procedure
     * @param at
     *            location
     * @return the locations, empty if the location is unreachable
     */
    public Set<Location> dependenciesOf(Place place, Location at) {
        FlowDomain state = getStateAt(at);
        if (state == null) {
            return new LinkedHashSet<>();
        }
        IndexSet<Location> deps = analysis.readDependencies(state, place);
        return new LinkedHashSet<>(deps.elements());
    }

    /**
     * Places whose value after a location may have been influenced by a source
     * location
     *
     * @param source
     *            influencing location
     * @param at
     *            location at which to inspect the state
     * @return the influenced places
     */
    public Set<Place> placesInfluencedBy(Location source, Location at) {
        return influenced(source, getStateAt(at));
    }

    /**
     * Places whose value when the procedure returns may have been influenced
     * by a source location
     *
     * @param source
     *            influencing location
     * @return the influenced places
     */
    public Set<Place> placesInfluencedBy(Location source) {
        return influenced(source, getExitSummary());
    }

    private static Set<Place> influenced(Location source, FlowDomain state) {
        Set<Place> s = new LinkedHashSet<>();
        if (state == null) {
            return s;
        }
        for (Place p : state.rows()) {
            if (state.rowSet(p).contains(source)) {
                s.add(p);
            }
        }
        return s;
    }

    @Override
    public String toString() {
        return "FlowResults for " + getBody().getId();
    }
}
