package analysis.ir;

import java.util.Set;

/**
 * May-alias information for the places of one procedure. Answers must over
 * approximate: a missing alias makes the dependency analysis unsound.
 */
public interface AliasOracle {

    /**
     * Places the given place may denote
     *
     * @param place
     *            place in the procedure
     * @param mutability
     *            {@link Mutability#MUT} when the place is written, so only
     *            writable paths are followed
     * @return the aliases, always including the place itself
     */
    Set<Place> aliases(Place place, Mutability mutability);

    /**
     * Places whose values can be reached from the value of the given place,
     * through its fields and the references it contains
     *
     * @param place
     *            place in the procedure
     * @param mutability
     *            {@link Mutability#MUT} to only follow mutable references
     * @return the reachable places, including the place itself
     */
    Set<Place> reachableValues(Place place, Mutability mutability);
}
