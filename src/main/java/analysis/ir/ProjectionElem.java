package analysis.ir;

/**
 * One step of a {@link Place}'s projection path
 */
public final class ProjectionElem {

    /**
     * Kinds of projection
     */
    public enum Kind {
        /**
         * Select the field with the given index (of the current variant)
         */
        FIELD,
        /**
         * Follow a reference, raw pointer or box
         */
        DEREF,
        /**
         * Select an array or slice element by the value of a local
         */
        INDEX,
        /**
         * View an enum value as one of its variants
         */
        DOWNCAST;
    }

    private static final ProjectionElem DEREF = new ProjectionElem(Kind.DEREF, -1);

    private final Kind kind;
    /**
     * field index, index local or variant index depending on the kind
     */
    private final int value;

    private ProjectionElem(Kind kind, int value) {
        this.kind = kind;
        this.value = value;
    }

    public static ProjectionElem field(int index) {
        return new ProjectionElem(Kind.FIELD, index);
    }

    public static ProjectionElem deref() {
        return DEREF;
    }

    public static ProjectionElem index(int local) {
        return new ProjectionElem(Kind.INDEX, local);
    }

    public static ProjectionElem downcast(int variant) {
        return new ProjectionElem(Kind.DOWNCAST, variant);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return field index of a {@link Kind#FIELD} step
     */
    public int getField() {
        assert kind == Kind.FIELD;
        return value;
    }

    /**
     * @return the index local of an {@link Kind#INDEX} step
     */
    public int getIndexLocal() {
        assert kind == Kind.INDEX;
        return value;
    }

    /**
     * @return the variant of a {@link Kind#DOWNCAST} step
     */
    public int getVariant() {
        assert kind == Kind.DOWNCAST;
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof ProjectionElem)) {
            return false;
        }
        ProjectionElem other = (ProjectionElem) obj;
        return kind == other.kind && value == other.value;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + value;
    }

    @Override
    public String toString() {
        switch (kind) {
        case FIELD:
            return "." + value;
        case DEREF:
            return ".*";
        case INDEX:
            return "[_" + value + "]";
        case DOWNCAST:
            return "@" + value;
        default:
            throw new RuntimeException("Unknown projection " + kind);
        }
    }
}
