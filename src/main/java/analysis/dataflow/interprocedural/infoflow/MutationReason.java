package analysis.dataflow.interprocedural.infoflow;

/**
 * Cause of a mutation
 */
public final class MutationReason {

    public enum Kind {
        /**
         * Assignment statement
         */
        ASSIGNMENT,
        /**
         * A call may have written through one of its arguments
         */
        CALL_ARGUMENT,
        /**
         * The destination of a call receives the returned value
         */
        CALL_RETURN,
        /**
         * A borrow of a place is created
         */
        BORROW,
        /**
         * Anything else, such as setting an enum discriminant
         */
        OTHER;
    }

    public static final MutationReason ASSIGNMENT = new MutationReason(Kind.ASSIGNMENT, -1);
    public static final MutationReason CALL_RETURN = new MutationReason(Kind.CALL_RETURN, -1);
    public static final MutationReason BORROW = new MutationReason(Kind.BORROW, -1);
    public static final MutationReason OTHER = new MutationReason(Kind.OTHER, -1);

    private final Kind kind;
    private final int argument;

    private MutationReason(Kind kind, int argument) {
        this.kind = kind;
        this.argument = argument;
    }

    /**
     * @param index
     *            zero-based index of the actual argument
     * @return reason for a write through that argument
     */
    public static MutationReason callArgument(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Negative argument index " + index);
        }
        return new MutationReason(Kind.CALL_ARGUMENT, index);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return zero-based argument index of a {@link Kind#CALL_ARGUMENT} reason
     */
    public int getArgumentIndex() {
        assert kind == Kind.CALL_ARGUMENT;
        return argument;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof MutationReason)) {
            return false;
        }
        MutationReason other = (MutationReason) obj;
        return kind == other.kind && argument == other.argument;
    }

    @Override
    public int hashCode() {
        return kind.hashCode() * 31 + argument;
    }

    @Override
    public String toString() {
        return kind == Kind.CALL_ARGUMENT ? "CALL_ARGUMENT(" + argument + ")" : kind.toString();
    }
}
