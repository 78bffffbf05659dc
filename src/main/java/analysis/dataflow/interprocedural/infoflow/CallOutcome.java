package analysis.dataflow.interprocedural.infoflow;

/**
 * How a call site was treated
 */
public enum CallOutcome {
    /**
     * The callee was analyzed and its summary translated to the call site
     */
    RECURSED(true),
    /**
     * The call policy supplied the effects of the call
     */
    SKIPPED_WITH_EFFECTS(false),
    /**
     * The call policy asked for the conservative treatment
     */
    SKIPPED_OPAQUE(false),
    /**
     * Recursion into callees is turned off
     */
    OPAQUE_DISABLED(false),
    /**
     * The callee is not statically known, or is dispatched dynamically
     */
    OPAQUE_NOT_STATIC(false),
    /**
     * The callee never returns
     */
    OPAQUE_DIVERGES(false),
    /**
     * The callee has no body in the analyzed program
     */
    OPAQUE_EXTERNAL(false),
    /**
     * The callee contains unsafe code
     */
    OPAQUE_UNSAFE(false),
    /**
     * An argument contains a closure that may mutate or consume its captures
     */
    OPAQUE_CLOSURE(false),
    /**
     * The callee is already being analyzed
     */
    OPAQUE_RECURSIVE(false);

    private final boolean analyzed;

    private CallOutcome(boolean analyzed) {
        this.analyzed = analyzed;
    }

    /**
     * @return true if the callee's body contributed to the result
     */
    public boolean isAnalyzed() {
        return analyzed;
    }

    /**
     * @return true if the call was given the conservative treatment without
     *         the call policy asking for it
     */
    public boolean isConservative() {
        return !analyzed && this != SKIPPED_WITH_EFFECTS;
    }
}
