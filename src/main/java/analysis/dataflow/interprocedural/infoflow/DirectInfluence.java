package analysis.dataflow.interprocedural.infoflow;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import util.indexed.IndexMatrix;
import analysis.ir.BasicBlock;
import analysis.ir.Location;
import analysis.ir.Mutability;
import analysis.ir.Place;
import analysis.ir.Procedure;
import analysis.ir.Terminator;

/**
 * Flow-insensitive, single-step influence relation of a procedure: a place is
 * directly influenced by every location that mutates it or reads it as an
 * input of a mutation. Calls are treated opaquely.
 */
public class DirectInfluence {

    private final PlaceInfo placeInfo;
    private final IndexMatrix<Place, Location> influence;

    private DirectInfluence(PlaceInfo placeInfo, IndexMatrix<Place, Location> influence) {
        this.placeInfo = placeInfo;
        this.influence = influence;
    }

    /**
     * Compute the direct influence relation of the procedure described by the
     * place information
     *
     * @param placeInfo
     *            places and aliases of the procedure
     * @return the relation
     */
    public static DirectInfluence build(PlaceInfo placeInfo) {
        Procedure body = placeInfo.getBody();
        MutationVisitor visitor = new MutationVisitor(placeInfo);
        IndexMatrix<Place, Location> influence = new IndexMatrix<>(placeInfo.getPlaceDomain(),
                                                                   placeInfo.getLocationDomain());
        for (int b = 0; b < body.getBlocks().size(); b++) {
            BasicBlock bb = body.getBlock(b);
            for (int i = 0; i < bb.getStatements().size(); i++) {
                add(placeInfo, influence, visitor.visitStatement(bb.getStatements().get(i)), Location.make(b, i));
            }
            Terminator t = bb.getTerminator();
            if (t.getKind() == Terminator.Kind.CALL) {
                add(placeInfo, influence, visitor.opaqueCall(t), body.getTerminatorLocation(b));
            }
        }
        return new DirectInfluence(placeInfo, influence);
    }

    private static void add(PlaceInfo placeInfo, IndexMatrix<Place, Location> influence, List<Mutation> mutations,
                            Location loc) {
        for (Mutation m : mutations) {
            for (Place input : m.getInputs()) {
                for (Place r : placeInfo.reachableValues(input, Mutability.NOT)) {
                    influence.insert(r, loc);
                }
            }
            for (Place r : placeInfo.reachableValues(m.getMutated(), Mutability.MUT)) {
                influence.insert(r, loc);
            }
        }
    }

    /**
     * @param target
     *            place of the procedure
     * @return locations directly influencing any value reachable from the
     *         place
     */
    public Set<Location> lookup(Place target) {
        Set<Location> s = new LinkedHashSet<>();
        for (Place r : placeInfo.reachableValues(target, Mutability.NOT)) {
            s.addAll(influence.rowSet(r).elements());
        }
        return s;
    }
}
