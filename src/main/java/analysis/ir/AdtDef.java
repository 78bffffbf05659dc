package analysis.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Definition of a struct or enum. Variants are added after construction so that
 * recursive types can refer to their own definition. Definitions are compared
 * by identity.
 */
public final class AdtDef {

    private final String path;
    private final boolean isEnum;
    private final List<String> typeParameters;
    private final List<VariantDef> variants = new ArrayList<>();

    /**
     * @param path
     *            qualified name, e.g. <code>crate::shapes::Point</code>
     * @param isEnum
     *            true for an enum, false for a struct
     * @param typeParameters
     *            names of the generic parameters
     */
    public AdtDef(String path, boolean isEnum, List<String> typeParameters) {
        this.path = path;
        this.isEnum = isEnum;
        this.typeParameters = Collections.unmodifiableList(new ArrayList<>(typeParameters));
    }

    /**
     * Create a non-generic struct with the given fields
     *
     * @param path
     *            qualified name
     * @param fields
     *            fields of the only variant
     * @return the definition
     */
    public static AdtDef struct(String path, List<FieldDef> fields) {
        AdtDef d = new AdtDef(path, false, Collections.<String> emptyList());
        d.addVariant(new VariantDef(path.substring(path.lastIndexOf(':') + 1), fields));
        return d;
    }

    /**
     * @param v
     *            variant to append
     * @return index of the new variant
     */
    public int addVariant(VariantDef v) {
        if (!isEnum && !variants.isEmpty()) {
            throw new IllegalStateException("Struct " + path + " already has a variant");
        }
        variants.add(v);
        return variants.size() - 1;
    }

    public String getPath() {
        return path;
    }

    public boolean isEnum() {
        return isEnum;
    }

    public List<String> getTypeParameters() {
        return typeParameters;
    }

    public List<VariantDef> getVariants() {
        return Collections.unmodifiableList(variants);
    }

    public VariantDef getVariant(int i) {
        if (i < 0 || i >= variants.size()) {
            throw new IllegalArgumentException("No variant " + i + " in " + path);
        }
        return variants.get(i);
    }

    @Override
    public String toString() {
        return path;
    }
}
