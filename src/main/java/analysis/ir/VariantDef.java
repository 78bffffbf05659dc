package analysis.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Variant of an algebraic data type. A struct has exactly one.
 */
public final class VariantDef {

    private final String name;
    private final List<FieldDef> fields;

    public VariantDef(String name, List<FieldDef> fields) {
        this.name = name;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public String getName() {
        return name;
    }

    public List<FieldDef> getFields() {
        return fields;
    }

    public FieldDef getField(int i) {
        if (i < 0 || i >= fields.size()) {
            throw new IllegalArgumentException("No field " + i + " in variant " + name);
        }
        return fields.get(i);
    }

    @Override
    public String toString() {
        return name + fields;
    }
}
