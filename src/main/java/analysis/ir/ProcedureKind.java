package analysis.ir;

/**
 * Source of a procedure body
 */
public enum ProcedureKind {
    /**
     * Ordinary function or method
     */
    FN,
    /**
     * Closure body, local 1 is the closure environment
     */
    CLOSURE,
    /**
     * Compiler generated procedure that adapts an asynchronous procedure to
     * the ordinary calling convention by forwarding to it
     */
    ASYNC_WRAPPER;
}
