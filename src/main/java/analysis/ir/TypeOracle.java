package analysis.ir;

/**
 * Answers questions about projections that need the host type system
 */
public interface TypeOracle {

    /**
     * Type after applying one projection step
     *
     * @param base
     *            type of the place being projected
     * @param elem
     *            projection step
     * @return the type of the projected place, or null if the step is not valid
     *         for the base type
     */
    PlaceType projectionType(PlaceType base, ProjectionElem elem);

    /**
     * Whether a field may be accessed from code in a procedure
     *
     * @param base
     *            type of the place whose field is selected
     * @param field
     *            field index
     * @param scope
     *            procedure doing the access
     * @return true if the field is visible from the procedure's module
     */
    boolean isFieldAccessible(PlaceType base, int field, ProcedureId scope);
}
