package analysis.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Right hand side of an assignment
 */
public final class Rvalue {

    public enum Kind {
        USE,
        /**
         * Borrow a place, <code>&amp;p</code> or <code>&amp;mut p</code>
         */
        REF,
        /**
         * Raw address of a place
         */
        ADDRESS_OF, BINARY, UNARY, CAST,
        /**
         * Build a struct, enum variant, tuple, closure or array from operands
         */
        AGGREGATE, DISCRIMINANT, LEN,
        /**
         * Array filled with copies of one operand
         */
        REPEAT;
    }

    private final Kind kind;
    private final Mutability mutability;
    private final Place place;
    private final List<Operand> operands;
    private final Type type;
    private final int variant;
    private final String operator;

    private Rvalue(Kind kind, Mutability mutability, Place place, List<Operand> operands, Type type, int variant,
                   String operator) {
        this.kind = kind;
        this.mutability = mutability;
        this.place = place;
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        this.type = type;
        this.variant = variant;
        this.operator = operator;
    }

    private static List<Operand> none() {
        return Collections.emptyList();
    }

    public static Rvalue use(Operand op) {
        return new Rvalue(Kind.USE, null, null, Collections.singletonList(op), null, -1, null);
    }

    public static Rvalue ref(Mutability m, Place p) {
        return new Rvalue(Kind.REF, m, p, none(), null, -1, null);
    }

    public static Rvalue addressOf(Mutability m, Place p) {
        return new Rvalue(Kind.ADDRESS_OF, m, p, none(), null, -1, null);
    }

    public static Rvalue binary(String operator, Operand left, Operand right) {
        return new Rvalue(Kind.BINARY, null, null, Arrays.asList(left, right), null, -1, operator);
    }

    public static Rvalue unary(String operator, Operand op) {
        return new Rvalue(Kind.UNARY, null, null, Collections.singletonList(op), null, -1, operator);
    }

    public static Rvalue cast(Operand op, Type target) {
        return new Rvalue(Kind.CAST, null, null, Collections.singletonList(op), target, -1, null);
    }

    /**
     * @param type
     *            type being built
     * @param variant
     *            variant of an enum, -1 otherwise
     * @param operands
     *            one operand per field or element
     * @return the aggregate
     */
    public static Rvalue aggregate(Type type, int variant, List<Operand> operands) {
        return new Rvalue(Kind.AGGREGATE, null, null, operands, type, variant, null);
    }

    public static Rvalue discriminant(Place p) {
        return new Rvalue(Kind.DISCRIMINANT, null, p, none(), null, -1, null);
    }

    public static Rvalue len(Place p) {
        return new Rvalue(Kind.LEN, null, p, none(), null, -1, null);
    }

    public static Rvalue repeat(Operand op, Type arrayType) {
        return new Rvalue(Kind.REPEAT, null, null, Collections.singletonList(op), arrayType, -1, null);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return mutability of a borrow or address-of
     */
    public Mutability getMutability() {
        return mutability;
    }

    /**
     * @return the place of a borrow, address-of, discriminant or length
     */
    public Place getPlace() {
        return place;
    }

    public List<Operand> getOperands() {
        return operands;
    }

    /**
     * @return aggregate, cast target or repeat array type
     */
    public Type getType() {
        return type;
    }

    public int getVariant() {
        return variant;
    }

    public String getOperator() {
        return operator;
    }

    /**
     * @return every place whose value this rvalue reads, in operand order
     */
    public List<Place> getPlacesRead() {
        List<Place> l = new ArrayList<>();
        if (place != null) {
            l.add(place);
        }
        for (Operand op : operands) {
            if (op.getPlace() != null) {
                l.add(op.getPlace());
            }
        }
        return l;
    }

    @Override
    public String toString() {
        switch (kind) {
        case USE:
            return operands.get(0).toString();
        case REF:
            return (mutability == Mutability.MUT ? "&mut " : "&") + place;
        case ADDRESS_OF:
            return (mutability == Mutability.MUT ? "&raw mut " : "&raw const ") + place;
        case BINARY:
            return operator + "(" + operands.get(0) + ", " + operands.get(1) + ")";
        case UNARY:
            return operator + "(" + operands.get(0) + ")";
        case CAST:
            return operands.get(0) + " as " + type;
        case AGGREGATE:
            return type + (variant >= 0 ? "@" + variant : "") + operands;
        case DISCRIMINANT:
            return "discriminant(" + place + ")";
        case LEN:
            return "len(" + place + ")";
        case REPEAT:
            return "[" + operands.get(0) + "; _]";
        default:
            throw new RuntimeException("Unknown rvalue " + kind);
        }
    }
}
