package analysis.ir;

/**
 * How a closure may be called, which limits what it can do to its captures
 */
public enum ClosureKind {
    /**
     * Callable through a shared reference, captures are only read
     */
    FN,
    /**
     * Callable through a mutable reference, captures may be written
     */
    FN_MUT,
    /**
     * Callable once by value, captures may be consumed
     */
    FN_ONCE;
}
