package analysis.ir;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Type oracle that reads field types and visibilities directly from the
 * {@link AdtDef}s in the types
 */
public class StructuralTypeOracle implements TypeOracle {

    @Override
    public PlaceType projectionType(PlaceType base, ProjectionElem elem) {
        Type t = base.getType();
        switch (elem.getKind()) {
        case DEREF:
            return t.isPointer() ? new PlaceType(t.getInner()) : null;
        case INDEX:
            return t.getKind() == Type.Kind.ARRAY || t.getKind() == Type.Kind.SLICE ? new PlaceType(t.getInner())
                    : null;
        case DOWNCAST:
            if (t.getKind() != Type.Kind.ADT || !t.getAdt().isEnum()
                    || elem.getVariant() >= t.getAdt().getVariants().size()) {
                return null;
            }
            return new PlaceType(t, elem.getVariant());
        case FIELD:
            return fieldType(base, elem.getField());
        default:
            throw new RuntimeException("Unknown projection " + elem);
        }
    }

    private static PlaceType fieldType(PlaceType base, int field) {
        Type t = base.getType();
        switch (t.getKind()) {
        case TUPLE:
        case CLOSURE:
            List<Type> elems = t.getArguments();
            return field < elems.size() ? new PlaceType(elems.get(field)) : null;
        case ADT:
            FieldDef f = fieldDef(base, field);
            if (f == null) {
                return null;
            }
            return new PlaceType(f.getType().substitute(substitution(t)));
        default:
            return null;
        }
    }

    /**
     * Declared field of an ADT place, null if there is none
     */
    private static FieldDef fieldDef(PlaceType base, int field) {
        AdtDef def = base.getType().getAdt();
        int v;
        if (base.hasVariant()) {
            v = base.getVariant();
        }
        else if (!def.isEnum() && def.getVariants().size() == 1) {
            v = 0;
        }
        else {
            // fields of an enum are only reachable through a downcast
            return null;
        }
        List<FieldDef> fields = def.getVariant(v).getFields();
        return field < fields.size() ? fields.get(field) : null;
    }

    /**
     * Map from the ADT's parameter names to the type's arguments
     */
    private static Map<String, Type> substitution(Type adtType) {
        List<String> params = adtType.getAdt().getTypeParameters();
        Map<String, Type> m = new HashMap<>();
        for (int i = 0; i < params.size(); i++) {
            m.put(params.get(i), adtType.getArguments().get(i));
        }
        return m;
    }

    @Override
    public boolean isFieldAccessible(PlaceType base, int field, ProcedureId scope) {
        if (base.getType().getKind() != Type.Kind.ADT) {
            return true;
        }
        FieldDef f = fieldDef(base, field);
        return f != null && f.getVisibility().isAccessibleFrom(scope.getModulePath());
    }
}
