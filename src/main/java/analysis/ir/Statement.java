package analysis.ir;

/**
 * Non-terminating statement of a basic block
 */
public final class Statement {

    public enum Kind {
        ASSIGN, SET_DISCRIMINANT, STORAGE_LIVE, STORAGE_DEAD, NOP;
    }

    private static final Statement NOP = new Statement(Kind.NOP, null, null, -1);

    private final Kind kind;
    private final Place place;
    private final Rvalue rvalue;
    private final int variant;

    private Statement(Kind kind, Place place, Rvalue rvalue, int variant) {
        this.kind = kind;
        this.place = place;
        this.rvalue = rvalue;
        this.variant = variant;
    }

    public static Statement assign(Place p, Rvalue rv) {
        return new Statement(Kind.ASSIGN, p, rv, -1);
    }

    public static Statement setDiscriminant(Place p, int variant) {
        return new Statement(Kind.SET_DISCRIMINANT, p, null, variant);
    }

    public static Statement storageLive(int local) {
        return new Statement(Kind.STORAGE_LIVE, Place.local(local), null, -1);
    }

    public static Statement storageDead(int local) {
        return new Statement(Kind.STORAGE_DEAD, Place.local(local), null, -1);
    }

    public static Statement nop() {
        return NOP;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return assigned place, place whose discriminant is set, or the local
     *         whose storage changes
     */
    public Place getPlace() {
        return place;
    }

    public Rvalue getRvalue() {
        return rvalue;
    }

    public int getVariant() {
        return variant;
    }

    @Override
    public String toString() {
        switch (kind) {
        case ASSIGN:
            return place + " = " + rvalue;
        case SET_DISCRIMINANT:
            return "discriminant(" + place + ") = " + variant;
        case STORAGE_LIVE:
            return "StorageLive(" + place + ")";
        case STORAGE_DEAD:
            return "StorageDead(" + place + ")";
        case NOP:
            return "nop";
        default:
            throw new RuntimeException("Unknown statement " + kind);
        }
    }
}
