package analysis.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Type of a local or place. Types are immutable. ADT definitions are compared
 * by identity, everything else structurally.
 */
public final class Type {

    /**
     * Type constructors
     */
    public enum Kind {
        UNIT, NEVER, BOOL, INT, FLOAT, STR,
        /**
         * Struct or enum, arguments are the type arguments
         */
        ADT,
        /**
         * Tuple, arguments are the element types
         */
        TUPLE,
        /**
         * Reference, the single argument is the referent
         */
        REF,
        /**
         * Raw pointer, the single argument is the pointee
         */
        RAW_PTR,
        /**
         * Owning heap pointer, the single argument is the contents
         */
        BOX,
        /**
         * Fixed size array, the single argument is the element type
         */
        ARRAY,
        /**
         * Dynamically sized slice, the single argument is the element type
         */
        SLICE,
        /**
         * Closure, arguments are the types of the captured variables
         */
        CLOSURE,
        /**
         * Function item, arguments are its generic instantiation
         */
        FN_DEF,
        /**
         * Generic type parameter
         */
        PARAM,
        /**
         * Trait object, calls through it are dynamically dispatched
         */
        DYNAMIC;
    }

    private static final Type UNIT = new Type(Kind.UNIT, null, Collections.<Type> emptyList(), null, null, null, null);
    private static final Type NEVER = new Type(Kind.NEVER, null, Collections.<Type> emptyList(), null, null, null,
                                               null);
    private static final Type BOOL = new Type(Kind.BOOL, null, Collections.<Type> emptyList(), null, null, null, null);
    private static final Type INT = new Type(Kind.INT, null, Collections.<Type> emptyList(), null, null, null, null);
    private static final Type FLOAT = new Type(Kind.FLOAT, null, Collections.<Type> emptyList(), null, null, null,
                                               null);
    private static final Type STR = new Type(Kind.STR, null, Collections.<Type> emptyList(), null, null, null, null);

    private final Kind kind;
    /**
     * Mutability of references and raw pointers
     */
    private final Mutability mutability;
    private final List<Type> arguments;
    private final AdtDef adt;
    private final ClosureKind closureKind;
    /**
     * Closure body or named function item
     */
    private final ProcedureId procedure;
    /**
     * Name of a parameter or trait
     */
    private final String name;

    private Type(Kind kind, Mutability mutability, List<Type> arguments, AdtDef adt, ClosureKind closureKind,
                 ProcedureId procedure, String name) {
        this.kind = kind;
        this.mutability = mutability;
        this.arguments = arguments;
        this.adt = adt;
        this.closureKind = closureKind;
        this.procedure = procedure;
        this.name = name;
    }

    private static List<Type> list(List<Type> l) {
        return Collections.unmodifiableList(new ArrayList<>(l));
    }

    public static Type unit() {
        return UNIT;
    }

    public static Type never() {
        return NEVER;
    }

    public static Type bool() {
        return BOOL;
    }

    public static Type integer() {
        return INT;
    }

    public static Type floating() {
        return FLOAT;
    }

    public static Type str() {
        return STR;
    }

    public static Type adt(AdtDef def, Type... typeArguments) {
        return adt(def, Arrays.asList(typeArguments));
    }

    public static Type adt(AdtDef def, List<Type> typeArguments) {
        if (typeArguments.size() != def.getTypeParameters().size()) {
            throw new IllegalArgumentException(def + " expects " + def.getTypeParameters().size()
                    + " type arguments, got " + typeArguments.size());
        }
        return new Type(Kind.ADT, null, list(typeArguments), def, null, null, null);
    }

    public static Type tuple(Type... elements) {
        return tuple(Arrays.asList(elements));
    }

    public static Type tuple(List<Type> elements) {
        if (elements.isEmpty()) {
            return UNIT;
        }
        return new Type(Kind.TUPLE, null, list(elements), null, null, null, null);
    }

    public static Type ref(Mutability m, Type referent) {
        return new Type(Kind.REF, m, Collections.singletonList(referent), null, null, null, null);
    }

    public static Type rawPtr(Mutability m, Type pointee) {
        return new Type(Kind.RAW_PTR, m, Collections.singletonList(pointee), null, null, null, null);
    }

    public static Type box(Type contents) {
        return new Type(Kind.BOX, null, Collections.singletonList(contents), null, null, null, null);
    }

    public static Type array(Type element) {
        return new Type(Kind.ARRAY, null, Collections.singletonList(element), null, null, null, null);
    }

    public static Type slice(Type element) {
        return new Type(Kind.SLICE, null, Collections.singletonList(element), null, null, null, null);
    }

    public static Type closure(ProcedureId body, ClosureKind ck, List<Type> upvars) {
        return new Type(Kind.CLOSURE, null, list(upvars), null, ck, body, null);
    }

    public static Type fnDef(ProcedureId fn, List<Type> instantiation) {
        return new Type(Kind.FN_DEF, null, list(instantiation), null, null, fn, null);
    }

    public static Type param(String name) {
        return new Type(Kind.PARAM, null, Collections.<Type> emptyList(), null, null, null, name);
    }

    public static Type dynamic(String trait) {
        return new Type(Kind.DYNAMIC, null, Collections.<Type> emptyList(), null, null, null, trait);
    }

    public Kind getKind() {
        return kind;
    }

    public Mutability getMutability() {
        assert kind == Kind.REF || kind == Kind.RAW_PTR;
        return mutability;
    }

    /**
     * @return type arguments, tuple elements, upvar types or instantiation
     *         depending on the kind
     */
    public List<Type> getArguments() {
        return arguments;
    }

    /**
     * @return the referent, pointee, box contents or element type
     */
    public Type getInner() {
        assert arguments.size() == 1 && (kind == Kind.REF || kind == Kind.RAW_PTR || kind == Kind.BOX
                || kind == Kind.ARRAY || kind == Kind.SLICE) : "No inner type for " + this;
        return arguments.get(0);
    }

    public AdtDef getAdt() {
        return adt;
    }

    public ClosureKind getClosureKind() {
        return closureKind;
    }

    public ProcedureId getProcedure() {
        return procedure;
    }

    public String getName() {
        return name;
    }

    public boolean isUnit() {
        return kind == Kind.UNIT;
    }

    public boolean isNever() {
        return kind == Kind.NEVER;
    }

    /**
     * @return true for references, raw pointers and boxes
     */
    public boolean isPointer() {
        return kind == Kind.REF || kind == Kind.RAW_PTR || kind == Kind.BOX;
    }

    /**
     * @return true for references and raw pointers, which point to memory they
     *         do not own
     */
    public boolean isBorrow() {
        return kind == Kind.REF || kind == Kind.RAW_PTR;
    }

    /**
     * Replace generic parameters
     *
     * @param substitution
     *            parameter name to type
     * @return the instantiated type
     */
    public Type substitute(Map<String, Type> substitution) {
        if (kind == Kind.PARAM) {
            Type t = substitution.get(name);
            return t == null ? this : t;
        }
        if (arguments.isEmpty() || substitution.isEmpty()) {
            return this;
        }
        List<Type> args = new ArrayList<>(arguments.size());
        boolean changed = false;
        for (Type a : arguments) {
            Type s = a.substitute(substitution);
            changed |= s != a;
            args.add(s);
        }
        if (!changed) {
            return this;
        }
        return new Type(kind, mutability, Collections.unmodifiableList(args), adt, closureKind, procedure, name);
    }

    /**
     * @return this type followed by every type nested in its arguments, in
     *         preorder. ADT fields are not visited.
     */
    public List<Type> walk() {
        List<Type> l = new ArrayList<>();
        walk(l);
        return l;
    }

    private void walk(List<Type> acc) {
        acc.add(this);
        for (Type a : arguments) {
            a.walk(acc);
        }
    }

    /**
     * @param kinds
     *            closure kinds to look for
     * @return true if this type or any nested type is a closure of one of the
     *         kinds
     */
    public boolean containsClosure(ClosureKind... kinds) {
        for (Type t : walk()) {
            if (t.kind == Kind.CLOSURE) {
                for (ClosureKind k : kinds) {
                    if (t.closureKind == k) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Type)) {
            return false;
        }
        Type other = (Type) obj;
        return kind == other.kind && mutability == other.mutability && adt == other.adt
                && closureKind == other.closureKind && arguments.equals(other.arguments)
                && (procedure == null ? other.procedure == null : procedure.equals(other.procedure))
                && (name == null ? other.name == null : name.equals(other.name));
    }

    @Override
    public int hashCode() {
        int h = kind.hashCode();
        h = 31 * h + arguments.hashCode();
        h = 31 * h + (adt == null ? 0 : adt.getPath().hashCode());
        h = 31 * h + (name == null ? 0 : name.hashCode());
        h = 31 * h + (procedure == null ? 0 : procedure.hashCode());
        return h;
    }

    @Override
    public String toString() {
        switch (kind) {
        case UNIT:
            return "()";
        case NEVER:
            return "!";
        case BOOL:
            return "bool";
        case INT:
            return "int";
        case FLOAT:
            return "float";
        case STR:
            return "str";
        case ADT:
            return adt.getPath() + (arguments.isEmpty() ? "" : angle(arguments));
        case TUPLE:
            return "(" + join(arguments) + ")";
        case REF:
            return (mutability == Mutability.MUT ? "&mut " : "&") + arguments.get(0);
        case RAW_PTR:
            return (mutability == Mutability.MUT ? "*mut " : "*const ") + arguments.get(0);
        case BOX:
            return "Box<" + arguments.get(0) + ">";
        case ARRAY:
            return "[" + arguments.get(0) + "; _]";
        case SLICE:
            return "[" + arguments.get(0) + "]";
        case CLOSURE:
            return "{" + closureKind + " closure " + procedure + "}";
        case FN_DEF:
            return "fn " + procedure + (arguments.isEmpty() ? "" : angle(arguments));
        case PARAM:
            return name;
        case DYNAMIC:
            return "dyn " + name;
        default:
            throw new RuntimeException("Unknown type kind " + kind);
        }
    }

    private static String angle(List<Type> l) {
        return "<" + join(l) + ">";
    }

    private static String join(List<Type> l) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < l.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(l.get(i));
        }
        return sb.toString();
    }
}
