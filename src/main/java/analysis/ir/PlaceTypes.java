package analysis.ir;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Utilities for computing the types of places and enumerating the places
 * inside a value
 */
public final class PlaceTypes {

    /**
     * Methods are static
     */
    private PlaceTypes() {
        // intentionally blank
    }

    /**
     * Compute the type of a place
     *
     * @param body
     *            procedure the place belongs to
     * @param place
     *            place to compute the type for
     * @param types
     *            type oracle
     * @return type of the place, null if some projection step is not valid
     * @throws IllegalArgumentException
     *             if the place's local is not in the procedure
     */
    public static PlaceType typeOf(Procedure body, Place place, TypeOracle types) {
        PlaceType t = new PlaceType(body.getLocalType(place.getLocal()));
        for (ProjectionElem e : place.getProjection()) {
            t = types.projectionType(t, e);
            if (t == null) {
                return null;
            }
        }
        return t;
    }

    /**
     * Enumerate the place and every place nested inside it by field selection,
     * enum downcast or box dereference. References are not followed. Recursive
     * ADTs are expanded once per path.
     *
     * @param body
     *            procedure the place belongs to
     * @param place
     *            outermost place
     * @param types
     *            type oracle
     * @param maxDepth
     *            maximum number of projection steps added to the place
     * @return the place followed by its interior places in preorder
     */
    public static List<Place> interiorPlaces(Procedure body, Place place, TypeOracle types, int maxDepth) {
        List<Place> acc = new ArrayList<>();
        PlaceType t = typeOf(body, place, types);
        if (t == null) {
            acc.add(place);
            return acc;
        }
        interior(place, t, types, maxDepth, new HashSet<AdtDef>(), acc);
        return acc;
    }

    private static void interior(Place p, PlaceType t, TypeOracle types, int depth, Set<AdtDef> onPath,
                                 List<Place> acc) {
        acc.add(p);
        if (depth <= 0) {
            return;
        }
        Type ty = t.getType();
        switch (ty.getKind()) {
        case TUPLE:
        case CLOSURE:
            for (int i = 0; i < ty.getArguments().size(); i++) {
                step(p, t, ProjectionElem.field(i), types, depth, onPath, acc);
            }
            break;
        case BOX:
            step(p, t, ProjectionElem.deref(), types, depth, onPath, acc);
            break;
        case ADT:
            AdtDef def = ty.getAdt();
            if (!onPath.add(def)) {
                break;
            }
            if (t.hasVariant() || !def.isEnum()) {
                int v = t.hasVariant() ? t.getVariant() : 0;
                int n = def.getVariants().isEmpty() ? 0 : def.getVariant(v).getFields().size();
                for (int i = 0; i < n; i++) {
                    step(p, t, ProjectionElem.field(i), types, depth, onPath, acc);
                }
            }
            else {
                for (int v = 0; v < def.getVariants().size(); v++) {
                    if (!def.getVariant(v).getFields().isEmpty()) {
                        // the downcast itself does not count towards the depth
                        PlaceType vt = types.projectionType(t, ProjectionElem.downcast(v));
                        Place vp = p.downcast(v);
                        if (vt != null) {
                            int n = def.getVariant(v).getFields().size();
                            for (int i = 0; i < n; i++) {
                                step(vp, vt, ProjectionElem.field(i), types, depth, onPath, acc);
                            }
                        }
                    }
                }
            }
            onPath.remove(def);
            break;
        default:
            break;
        }
    }

    private static void step(Place p, PlaceType t, ProjectionElem e, TypeOracle types, int depth,
                             Set<AdtDef> onPath, List<Place> acc) {
        PlaceType next = types.projectionType(t, e);
        if (next != null) {
            interior(p.project(e), next, types, depth - 1, onPath, acc);
        }
    }
}
