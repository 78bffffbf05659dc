package analysis.ir;

/**
 * Declared field of an ADT variant. The type may mention the ADT's type
 * parameters.
 */
public final class FieldDef {

    private final String name;
    private final Type type;
    private final Visibility visibility;

    public FieldDef(String name, Type type, Visibility visibility) {
        this.name = name;
        this.type = type;
        this.visibility = visibility;
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    @Override
    public String toString() {
        return name + ": " + type;
    }
}
