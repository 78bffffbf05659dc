package analysis.dataflow.interprocedural.infoflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import analysis.ir.Mutability;
import analysis.ir.Operand;
import analysis.ir.Place;
import analysis.ir.PlaceType;
import analysis.ir.PlaceTypes;
import analysis.ir.Rvalue;
import analysis.ir.Statement;
import analysis.ir.Terminator;
import analysis.ir.Type;

/**
 * Enumerates the mutations performed by statements, and by calls that are not
 * analyzed
 */
public class MutationVisitor {

    private final PlaceInfo placeInfo;

    public MutationVisitor(PlaceInfo placeInfo) {
        this.placeInfo = placeInfo;
    }

    /**
     * @param s
     *            statement
     * @return the mutations the statement performs, in order
     */
    public List<Mutation> visitStatement(Statement s) {
        switch (s.getKind()) {
        case ASSIGN:
            return visitAssign(s.getPlace(), s.getRvalue());
        case SET_DISCRIMINANT:
            return Collections.singletonList(new Mutation(s.getPlace(), Collections.<Place> emptyList(),
                                                          MutationReason.OTHER, MutationStatus.POSSIBLE));
        case STORAGE_LIVE:
        case STORAGE_DEAD:
        case NOP:
            return Collections.emptyList();
        default:
            throw new RuntimeException("Unknown statement kind " + s.getKind());
        }
    }

    private static List<Mutation> visitAssign(Place lhs, Rvalue rv) {
        switch (rv.getKind()) {
        case AGGREGATE:
            if (isFieldWise(rv)) {
                List<Mutation> l = new ArrayList<>(rv.getOperands().size());
                for (int i = 0; i < rv.getOperands().size(); i++) {
                    Place in = rv.getOperands().get(i).getPlace();
                    List<Place> inputs = in == null ? Collections.<Place> emptyList() : Collections.singletonList(in);
                    l.add(new Mutation(lhs.field(i), inputs, MutationReason.ASSIGNMENT, MutationStatus.DEFINITE));
                }
                return l;
            }
            break;
        case REF:
        case ADDRESS_OF:
            return Collections.singletonList(new Mutation(lhs, Collections.singletonList(rv.getPlace()),
                                                          MutationReason.BORROW, MutationStatus.DEFINITE));
        default:
            break;
        }
        return Collections.singletonList(new Mutation(lhs, rv.getPlacesRead(), MutationReason.ASSIGNMENT,
                                                      MutationStatus.DEFINITE));
    }

    /**
     * Structs, tuples and closures with fields are assigned one field at a time
     */
    private static boolean isFieldWise(Rvalue aggregate) {
        if (aggregate.getOperands().isEmpty()) {
            return false;
        }
        Type t = aggregate.getType();
        switch (t.getKind()) {
        case TUPLE:
        case CLOSURE:
            return true;
        case ADT:
            return !t.getAdt().isEnum();
        default:
            return false;
        }
    }

    /**
     * Conservative effect of a call whose callee is not analyzed: the
     * destination depends on every argument, and anything reachable from an
     * argument through a mutable reference may be written with every argument
     * as input.
     *
     * @param call
     *            call terminator
     * @return the mutations
     */
    public List<Mutation> opaqueCall(Terminator call) {
        List<Place> argPlaces = new ArrayList<>();
        for (Operand op : call.getArgs()) {
            if (op.getPlace() != null) {
                argPlaces.add(op.getPlace());
            }
        }
        List<Mutation> l = new ArrayList<>();
        Place dest = call.getDestination();
        PlaceType destType = PlaceTypes.typeOf(placeInfo.getBody(), dest, placeInfo.getTypes());
        boolean unit = destType != null && destType.getType().isUnit();
        l.add(new Mutation(dest, unit ? Collections.<Place> emptyList() : argPlaces, MutationReason.CALL_RETURN,
                           MutationStatus.DEFINITE));
        for (int i = 0; i < call.getArgs().size(); i++) {
            Place arg = call.getArgs().get(i).getPlace();
            if (arg == null) {
                continue;
            }
            for (Place reachable : placeInfo.reachableValues(arg, Mutability.MUT)) {
                if (!reachable.equals(arg)) {
                    l.add(new Mutation(reachable, argPlaces, MutationReason.callArgument(i), MutationStatus.POSSIBLE));
                }
            }
        }
        return l;
    }
}
