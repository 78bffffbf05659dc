package analysis.pointer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import analysis.ir.AliasOracle;
import analysis.ir.AliasOracleFactory;
import analysis.ir.BasicBlock;
import analysis.ir.Mutability;
import analysis.ir.Operand;
import analysis.ir.Place;
import analysis.ir.PlaceType;
import analysis.ir.PlaceTypes;
import analysis.ir.Procedure;
import analysis.ir.ProjectionElem;
import analysis.ir.Rvalue;
import analysis.ir.Statement;
import analysis.ir.Terminator;
import analysis.ir.Type;
import analysis.ir.TypeOracle;

/**
 * Flow-insensitive, intraprocedural points-to analysis over borrows. Each place
 * that holds a reference is mapped to the loans it may carry, a loan being a
 * borrowed place and the mutability of the borrow. The loans are computed by
 * iterating over every statement until nothing changes.
 * <p>
 * A place is resolved by replacing the pointer before its first dereference
 * with each borrowed place the pointer may carry. The unresolved place is
 * always kept, so a pointer with no known loans (a parameter, for example)
 * still aliases its own dereference.
 */
public class BorrowPointsToAnalysis implements AliasOracle {

    /**
     * Places with longer projections are never tracked
     */
    public static final int MAX_PROJECTION_LENGTH = 8;
    /**
     * Bound on the number of passes over the body
     */
    private static final int MAX_PASSES = 1000;

    private final Procedure body;
    private final TypeOracle types;
    /**
     * Depth to which values are expanded into their fields
     */
    private final int maxDepth;
    /**
     * Pointer place to the loans it may carry
     */
    private final Map<Place, Set<Loan>> loans = new LinkedHashMap<>();
    /**
     * Memoized queries, by requested mutability then place
     */
    private final Map<Mutability, Map<Place, Set<Place>>> aliasMemo = new EnumMap<>(Mutability.class);
    private final Map<Mutability, Map<Place, Set<Place>>> reachableMemo = new EnumMap<>(Mutability.class);
    private boolean solved = false;

    /**
     * Compute the loans of every pointer in the body
     *
     * @param body
     *            procedure to analyze
     * @param types
     *            type oracle for projections
     * @param maxDepth
     *            depth to which values are expanded into their fields
     */
    public BorrowPointsToAnalysis(Procedure body, TypeOracle types, int maxDepth) {
        this.body = body;
        this.types = types;
        this.maxDepth = maxDepth;
        solve();
    }

    private void solve() {
        boolean changed = true;
        int passes = 0;
        while (changed) {
            changed = false;
            for (BasicBlock bb : body.getBlocks()) {
                for (Statement s : bb.getStatements()) {
                    if (s.getKind() == Statement.Kind.ASSIGN) {
                        changed |= processAssign(s.getPlace(), s.getRvalue());
                    }
                }
                Terminator t = bb.getTerminator();
                if (t.getKind() == Terminator.Kind.CALL) {
                    changed |= processCall(t.getDestination(), t.getArgs());
                }
            }
            if (++passes > MAX_PASSES) {
                throw new RuntimeException("Borrow analysis of " + body.getId() + " did not converge after "
                        + MAX_PASSES + " passes");
            }
        }
        solved = true;
    }

    private boolean processAssign(Place lhs, Rvalue rv) {
        Set<Place> targets = aliases(lhs, Mutability.MUT);
        switch (rv.getKind()) {
        case REF:
        case ADDRESS_OF:
            boolean changed = false;
            for (Place borrowed : aliases(rv.getPlace(), rv.getMutability())) {
                Loan loan = new Loan(borrowed, rv.getMutability());
                for (Place t : targets) {
                    changed |= addLoans(t, Collections.singleton(loan));
                }
            }
            return changed;
        case USE:
        case CAST:
        case REPEAT:
            Place src = rv.getOperands().get(0).getPlace();
            return src != null && copyInto(targets, src);
        case AGGREGATE:
            changed = false;
            for (int i = 0; i < rv.getOperands().size(); i++) {
                Place opPlace = rv.getOperands().get(i).getPlace();
                if (opPlace == null) {
                    continue;
                }
                Set<Place> fieldTargets = new LinkedHashSet<>();
                for (Place t : targets) {
                    fieldTargets.add(aggregateField(t, rv, i));
                }
                changed |= copyInto(fieldTargets, opPlace);
            }
            return changed;
        default:
            return false;
        }
    }

    /**
     * Place of the i-th field of an aggregate assigned to p
     */
    static Place aggregateField(Place p, Rvalue aggregate, int i) {
        Type t = aggregate.getType();
        switch (t.getKind()) {
        case ARRAY:
            // array elements are not distinguished
            return p;
        case ADT:
            if (t.getAdt().isEnum()) {
                return p.downcast(aggregate.getVariant()).field(i);
            }
            return p.field(i);
        default:
            return p.field(i);
        }
    }

    /**
     * Copy the loans of every pointer inside src to the corresponding places
     * inside each target
     */
    private boolean copyInto(Set<Place> targets, Place src) {
        boolean changed = false;
        for (Place s : aliases(src, Mutability.NOT)) {
            for (Map.Entry<Place, Set<Loan>> e : snapshot()) {
                Place key = e.getKey();
                if (!s.isPrefixOf(key)) {
                    continue;
                }
                List<ProjectionElem> suffix = key.getProjection().subList(s.getProjection().size(),
                                                                            key.getProjection().size());
                for (Place t : targets) {
                    changed |= addLoans(append(t, suffix), e.getValue());
                }
            }
        }
        return changed;
    }

    /**
     * A call may return, or store through its mutable arguments, any loan
     * reachable from its arguments
     */
    private boolean processCall(Place destination, List<Operand> args) {
        Set<Loan> reachable = new LinkedHashSet<>();
        Deque<Place> worklist = new ArrayDeque<>();
        Set<Place> visited = new HashSet<>();
        for (Operand op : args) {
            if (op.getPlace() != null) {
                worklist.add(op.getPlace());
            }
        }
        while (!worklist.isEmpty()) {
            Place p = worklist.poll();
            for (Place a : aliases(p, Mutability.NOT)) {
                if (!visited.add(a)) {
                    continue;
                }
                for (Map.Entry<Place, Set<Loan>> e : snapshot()) {
                    if (a.isPrefixOf(e.getKey())) {
                        for (Loan loan : e.getValue()) {
                            if (reachable.add(loan)) {
                                worklist.add(loan.getBorrowed());
                            }
                        }
                    }
                }
            }
        }
        if (reachable.isEmpty()) {
            return false;
        }
        boolean changed = false;
        for (Place d : aliases(destination, Mutability.MUT)) {
            changed |= addLoans(d, reachable);
        }
        for (Loan loan : new ArrayList<>(reachable)) {
            if (loan.getMutability() != Mutability.MUT) {
                continue;
            }
            PlaceType t = PlaceTypes.typeOf(body, loan.getBorrowed(), types);
            if (t != null && t.getType().isBorrow()) {
                changed |= addLoans(loan.getBorrowed(), reachable);
            }
        }
        return changed;
    }

    private List<Map.Entry<Place, Set<Loan>>> snapshot() {
        return new ArrayList<>(loans.entrySet());
    }

    private boolean addLoans(Place key, Set<Loan> newLoans) {
        if (key.getProjection().size() > MAX_PROJECTION_LENGTH) {
            return false;
        }
        Set<Loan> s = loans.get(key);
        if (s == null) {
            s = new LinkedHashSet<>();
            loans.put(key, s);
        }
        return s.addAll(newLoans);
    }

    private static Place append(Place p, List<ProjectionElem> suffix) {
        if (suffix.isEmpty()) {
            return p;
        }
        List<ProjectionElem> l = new ArrayList<>(p.getProjection());
        l.addAll(suffix);
        return Place.make(p.getLocal(), l);
    }

    /**
     * @param pointer
     *            place holding a reference
     * @return the loans the place may carry, empty if unknown
     */
    public Set<Loan> getLoans(Place pointer) {
        Set<Loan> s = loans.get(pointer);
        return s == null ? Collections.<Loan> emptySet() : Collections.unmodifiableSet(s);
    }

    @Override
    public Set<Place> aliases(Place place, Mutability mutability) {
        if (!solved) {
            Set<Place> acc = new LinkedHashSet<>();
            resolve(place, mutability, acc);
            return acc;
        }
        Map<Place, Set<Place>> memo = memoFor(aliasMemo, mutability);
        Set<Place> s = memo.get(place);
        if (s == null) {
            body.checkPlace(place);
            s = new LinkedHashSet<>();
            resolve(place, mutability, s);
            s = Collections.unmodifiableSet(s);
            memo.put(place, s);
        }
        return s;
    }

    private void resolve(Place place, Mutability mutability, Set<Place> acc) {
        if (!acc.add(place)) {
            return;
        }
        List<ProjectionElem> proj = place.getProjection();
        int deref = proj.indexOf(ProjectionElem.deref());
        if (deref < 0) {
            return;
        }
        Place pointer = place.truncate(deref);
        List<ProjectionElem> rest = proj.subList(deref + 1, proj.size());
        Set<Place> pointers = new LinkedHashSet<>();
        resolve(pointer, mutability, pointers);
        for (Place ptr : pointers) {
            Set<Loan> ls = loans.get(ptr);
            if (ls == null) {
                continue;
            }
            for (Loan loan : ls) {
                if (loan.permits(mutability)) {
                    Place target = append(loan.getBorrowed(), rest);
                    if (target.getProjection().size() <= MAX_PROJECTION_LENGTH) {
                        resolve(target, mutability, acc);
                    }
                }
            }
        }
    }

    @Override
    public Set<Place> reachableValues(Place place, Mutability mutability) {
        Map<Place, Set<Place>> memo = memoFor(reachableMemo, mutability);
        Set<Place> s = memo.get(place);
        if (s != null) {
            return s;
        }
        body.checkPlace(place);
        s = new LinkedHashSet<>();
        Deque<Place> worklist = new ArrayDeque<>();
        worklist.add(place);
        while (!worklist.isEmpty()) {
            Place p = worklist.poll();
            if (!s.add(p)) {
                continue;
            }
            for (Place inner : PlaceTypes.interiorPlaces(body, p, types, maxDepth)) {
                PlaceType t = PlaceTypes.typeOf(body, inner, types);
                if (t == null || !t.getType().isBorrow() || !t.getType().getMutability().permits(mutability)) {
                    continue;
                }
                Place target = inner.deref();
                if (target.getProjection().size() <= MAX_PROJECTION_LENGTH) {
                    worklist.add(target);
                }
            }
        }
        s = Collections.unmodifiableSet(s);
        memo.put(place, s);
        return s;
    }

    private static Map<Place, Set<Place>> memoFor(Map<Mutability, Map<Place, Set<Place>>> memos, Mutability m) {
        Map<Place, Set<Place>> memo = memos.get(m);
        if (memo == null) {
            memo = new HashMap<>();
            memos.put(m, memo);
        }
        return memo;
    }

    @Override
    public String toString() {
        return "Loans of " + body.getId() + ": " + loans;
    }

    /**
     * Creates a {@link BorrowPointsToAnalysis} for each body
     */
    public static class Factory implements AliasOracleFactory {

        private final int maxDepth;

        /**
         * @param maxDepth
         *            depth to which values are expanded into their fields
         */
        public Factory(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        @Override
        public AliasOracle build(Procedure body, TypeOracle types) {
            return new BorrowPointsToAnalysis(body, types, maxDepth);
        }
    }
}
