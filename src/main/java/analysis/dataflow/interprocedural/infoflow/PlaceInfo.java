package analysis.dataflow.interprocedural.infoflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import util.indexed.IndexedDomain;
import analysis.ir.AliasOracle;
import analysis.ir.BasicBlock;
import analysis.ir.Location;
import analysis.ir.Mutability;
import analysis.ir.Operand;
import analysis.ir.Place;
import analysis.ir.PlaceTypes;
import analysis.ir.Procedure;
import analysis.ir.Statement;
import analysis.ir.Terminator;
import analysis.ir.TypeOracle;

/**
 * Places and locations of one procedure, interned into the domains shared by
 * every flow state of the procedure, together with the alias queries the
 * transfer function needs. Every place handed out has been checked against the
 * procedure's locals.
 */
public class PlaceInfo {

    private final Procedure body;
    private final AliasOracle aliasOracle;
    private final TypeOracle types;
    private final int maxDepth;
    private final IndexedDomain<Place> placeDomain = new IndexedDomain<>();
    private final IndexedDomain<Location> locationDomain;
    /**
     * Conflicting places of every place asked about so far
     */
    private final Map<Place, Set<Place>> conflictMemo = new HashMap<>();
    /**
     * Number of interned places already accounted for in the conflict memo
     */
    private int conflictMemoDomainSize = 0;
    /**
     * Once frozen, places are checked but no longer interned
     */
    private boolean frozen = false;

    /**
     * @param body
     *            procedure
     * @param aliasOracle
     *            alias information for the procedure
     * @param types
     *            type oracle
     * @param maxDepth
     *            depth to which values are expanded into their fields
     */
    public PlaceInfo(Procedure body, AliasOracle aliasOracle, TypeOracle types, int maxDepth) {
        this.body = body;
        this.aliasOracle = aliasOracle;
        this.types = types;
        this.maxDepth = maxDepth;
        this.locationDomain = new IndexedDomain<>(body.getAllLocations());

        for (int local = 0; local < body.getNumLocals(); local++) {
            for (Place p : PlaceTypes.interiorPlaces(body, Place.local(local), types, maxDepth)) {
                placeDomain.intern(p);
            }
        }
        for (int arg = 1; arg <= body.getArgCount(); arg++) {
            for (Place p : getArgumentPlaces(arg)) {
                placeDomain.intern(p);
            }
        }
        for (Place p : collectBodyPlaces(body)) {
            for (Place prefix : p.prefixes()) {
                normalize(prefix);
            }
        }
    }

    /**
     * Every place an instruction of the body mentions
     */
    private static List<Place> collectBodyPlaces(Procedure body) {
        List<Place> l = new ArrayList<>();
        for (BasicBlock bb : body.getBlocks()) {
            for (Statement s : bb.getStatements()) {
                if (s.getKind() == Statement.Kind.ASSIGN || s.getKind() == Statement.Kind.SET_DISCRIMINANT) {
                    l.add(s.getPlace());
                }
                if (s.getRvalue() != null) {
                    l.addAll(s.getRvalue().getPlacesRead());
                }
            }
            Terminator t = bb.getTerminator();
            switch (t.getKind()) {
            case SWITCH_INT:
                addOperand(t.getDiscriminant(), l);
                break;
            case DROP:
                l.add(t.getDroppedPlace());
                break;
            case CALL:
                addOperand(t.getFunction(), l);
                for (Operand op : t.getArgs()) {
                    addOperand(op, l);
                }
                l.add(t.getDestination());
                break;
            default:
                break;
            }
        }
        return l;
    }

    private static void addOperand(Operand op, List<Place> l) {
        if (op.getPlace() != null) {
            l.add(op.getPlace());
        }
    }

    /**
     * Check that the place belongs to the procedure and intern it, unless the
     * domain has been frozen
     *
     * @param p
     *            place
     * @return the same place
     * @throws IllegalArgumentException
     *             if the place's local is not a local of the procedure
     */
    public Place normalize(Place p) {
        body.checkPlace(p);
        if (!frozen) {
            placeDomain.intern(p);
        }
        return p;
    }

    /**
     * Stop interning places. Called once the analysis of the procedure is
     * done, queries on the results then leave the place domain unchanged.
     */
    void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * @param arg
     *            argument local
     * @return places the caller supplies through the argument: the interior of
     *         every value reachable from it
     */
    public List<Place> getArgumentPlaces(int arg) {
        Set<Place> s = new LinkedHashSet<>();
        for (Place r : aliasOracle.reachableValues(Place.local(arg), Mutability.NOT)) {
            s.addAll(PlaceTypes.interiorPlaces(body, r, types, maxDepth));
        }
        return new ArrayList<>(s);
    }

    /**
     * @param p
     *            place
     * @param m
     *            required mutability
     * @return interned aliases of the place
     */
    public Set<Place> aliases(Place p, Mutability m) {
        Set<Place> s = aliasOracle.aliases(normalize(p), m);
        for (Place a : s) {
            normalize(a);
        }
        return s;
    }

    /**
     * @param p
     *            place
     * @param m
     *            required mutability
     * @return interned places reachable from the place's value
     */
    public Set<Place> reachableValues(Place p, Mutability m) {
        Set<Place> s = aliasOracle.reachableValues(normalize(p), m);
        for (Place r : s) {
            normalize(r);
        }
        return s;
    }

    /**
     * @param p
     *            place
     * @return every interned place that overlaps the place syntactically: its
     *         prefixes and its extensions, including itself
     */
    public Set<Place> conflicts(Place p) {
        normalize(p);
        if (conflictMemoDomainSize != placeDomain.size()) {
            extendConflictMemo();
        }
        Set<Place> memo = conflictMemo.get(p);
        if (memo == null) {
            memo = new LinkedHashSet<>();
            for (Place q : placeDomain) {
                if (conflict(p, q)) {
                    memo.add(q);
                }
            }
            conflictMemo.put(p, memo);
        }
        return Collections.unmodifiableSet(memo);
    }

    /**
     * Add the places interned since the last call to the memoized conflicts
     */
    private void extendConflictMemo() {
        int size = placeDomain.size();
        for (int i = conflictMemoDomainSize; i < size; i++) {
            Place q = placeDomain.value(i);
            for (Map.Entry<Place, Set<Place>> e : conflictMemo.entrySet()) {
                if (conflict(e.getKey(), q)) {
                    e.getValue().add(q);
                }
            }
        }
        conflictMemoDomainSize = size;
    }

    private static boolean conflict(Place p, Place q) {
        return q.isPrefixOf(p) || p.isPrefixOf(q);
    }

    /**
     * @param p
     *            place
     * @return every interned place that extends the place, including itself
     */
    public Set<Place> children(Place p) {
        normalize(p);
        Set<Place> s = new LinkedHashSet<>();
        for (Place q : placeDomain) {
            if (p.isPrefixOf(q)) {
                s.add(q);
            }
        }
        return s;
    }

    public Procedure getBody() {
        return body;
    }

    public TypeOracle getTypes() {
        return types;
    }

    public IndexedDomain<Place> getPlaceDomain() {
        return placeDomain;
    }

    public IndexedDomain<Location> getLocationDomain() {
        return locationDomain;
    }
}
