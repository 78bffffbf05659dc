package analysis.ir;

/**
 * Declaration of a local variable
 */
public final class LocalDecl {

    private final Type type;
    /**
     * Source name, null for compiler temporaries
     */
    private final String name;

    public LocalDecl(Type type, String name) {
        this.type = type;
        this.name = name;
    }

    public Type getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return (name == null ? "" : name + ": ") + type;
    }
}
