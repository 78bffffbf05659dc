package analysis.ir;

/**
 * Type of a place together with the enum variant it has been downcast to, if
 * any
 */
public final class PlaceType {

    private final Type type;
    /**
     * Variant selected by a downcast, -1 if none
     */
    private final int variant;

    public PlaceType(Type type) {
        this(type, -1);
    }

    public PlaceType(Type type, int variant) {
        this.type = type;
        this.variant = variant;
    }

    public Type getType() {
        return type;
    }

    public boolean hasVariant() {
        return variant >= 0;
    }

    public int getVariant() {
        return variant;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof PlaceType)) {
            return false;
        }
        PlaceType other = (PlaceType) obj;
        return variant == other.variant && type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return type.hashCode() * 31 + variant;
    }

    @Override
    public String toString() {
        return hasVariant() ? type + "@" + variant : type.toString();
    }
}
