package analysis.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Value used by an rvalue or call: the contents of a place, a constant, or a
 * function item
 */
public final class Operand {

    public enum Kind {
        COPY, MOVE, CONSTANT,
        /**
         * Named function, possibly a trait method that is dispatched dynamically
         */
        FUNCTION;
    }

    private final Kind kind;
    private final Place place;
    private final Type type;
    private final String value;
    private final ProcedureId function;
    private final List<Type> instantiation;
    private final boolean dynamic;

    private Operand(Kind kind, Place place, Type type, String value, ProcedureId function, List<Type> instantiation,
                    boolean dynamic) {
        this.kind = kind;
        this.place = place;
        this.type = type;
        this.value = value;
        this.function = function;
        this.instantiation = instantiation;
        this.dynamic = dynamic;
    }

    public static Operand copy(Place p) {
        return new Operand(Kind.COPY, p, null, null, null, Collections.<Type> emptyList(), false);
    }

    public static Operand move(Place p) {
        return new Operand(Kind.MOVE, p, null, null, null, Collections.<Type> emptyList(), false);
    }

    public static Operand constant(String value, Type type) {
        return new Operand(Kind.CONSTANT, null, type, value, null, Collections.<Type> emptyList(), false);
    }

    /**
     * @param fn
     *            statically named function
     * @param instantiation
     *            generic arguments of the function
     * @return operand naming the function
     */
    public static Operand function(ProcedureId fn, List<Type> instantiation) {
        return new Operand(Kind.FUNCTION, null, null, null, fn, Collections.unmodifiableList(new ArrayList<>(
                instantiation)), false);
    }

    /**
     * @param method
     *            trait method whose implementation is chosen at run time
     * @return operand naming the method
     */
    public static Operand dynamicFunction(ProcedureId method) {
        return new Operand(Kind.FUNCTION, null, null, null, method, Collections.<Type> emptyList(), true);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the place read by this operand, null for constants and functions
     */
    public Place getPlace() {
        return place;
    }

    /**
     * @return type of a constant
     */
    public Type getConstantType() {
        return type;
    }

    public String getConstantValue() {
        return value;
    }

    public ProcedureId getFunction() {
        return function;
    }

    public List<Type> getInstantiation() {
        return instantiation;
    }

    public boolean isDynamic() {
        return dynamic;
    }

    @Override
    public String toString() {
        switch (kind) {
        case COPY:
            return place.toString();
        case MOVE:
            return "move " + place;
        case CONSTANT:
            return "const " + value;
        case FUNCTION:
            return (dynamic ? "dyn " : "") + function + (instantiation.isEmpty() ? "" : instantiation.toString());
        default:
            throw new RuntimeException("Unknown operand " + kind);
        }
    }
}
