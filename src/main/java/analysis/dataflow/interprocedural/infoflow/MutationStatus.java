package analysis.dataflow.interprocedural.infoflow;

/**
 * Confidence that a mutation overwrites its target
 */
public enum MutationStatus {
    /**
     * The whole target is overwritten, previous dependencies of a direct target
     * are discarded
     */
    DEFINITE,
    /**
     * The target may be written, previous dependencies are kept
     */
    POSSIBLE;
}
