package analysis.ir;

/**
 * Whether a reference (or a requested alias set) permits writes
 */
public enum Mutability {
    /**
     * Read-only
     */
    NOT,
    /**
     * Readable and writable
     */
    MUT;

    /**
     * @param required
     *            the mutability that is needed
     * @return true if a reference of this mutability can be used where
     *         <code>required</code> is needed
     */
    public boolean permits(Mutability required) {
        return this == MUT || required == NOT;
    }
}
