package analysis.dataflow.interprocedural.pdg.graph;

/**
 * Label for the dependence graph edges with the type of the dependency
 * between the two program points.
 */
public enum DependenceEdgeType {
    /**
     * The value written at the target may have been computed from a value
     * last written at the source.
     */
    DATA,
    /**
     * Whether the target executes depends on the branch taken at the source.
     */
    CONTROL,
    /**
     * From a call site in the caller to a parameter of the analyzed callee.
     */
    CALL,
    /**
     * From a return of the analyzed callee back to the call site in the
     * caller.
     */
    RETURN;

    /**
     * Short name for display
     *
     * @return unique but short type name
     */
    public String shortName() {
        switch (this) {
        case CALL:
            return "CL";
        case RETURN:
            return "R";
        default:
            return this.toString().substring(0, 1);
        }
    }
}
