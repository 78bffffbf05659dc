package analysis.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Last instruction of a basic block, determines the successors
 */
public final class Terminator {

    public enum Kind {
        GOTO, SWITCH_INT, RETURN, UNREACHABLE, DROP, CALL;
    }

    private final Kind kind;
    private final List<Integer> targets;
    /**
     * Switch discriminant or called function
     */
    private final Operand operand;
    /**
     * Dropped place or call destination
     */
    private final Place place;
    private final List<Operand> args;
    /**
     * Unwind successor of a call, null if none
     */
    private final Integer cleanup;

    private Terminator(Kind kind, List<Integer> targets, Operand operand, Place place, List<Operand> args,
                       Integer cleanup) {
        this.kind = kind;
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
        this.operand = operand;
        this.place = place;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.cleanup = cleanup;
    }

    private static List<Integer> none() {
        return Collections.emptyList();
    }

    public static Terminator jump(int target) {
        return new Terminator(Kind.GOTO, Collections.singletonList(target), null, null,
                              Collections.<Operand> emptyList(), null);
    }

    public static Terminator switchInt(Operand discriminant, List<Integer> targets) {
        return new Terminator(Kind.SWITCH_INT, targets, discriminant, null, Collections.<Operand> emptyList(), null);
    }

    public static Terminator ret() {
        return new Terminator(Kind.RETURN, none(), null, null, Collections.<Operand> emptyList(), null);
    }

    public static Terminator unreachable() {
        return new Terminator(Kind.UNREACHABLE, none(), null, null, Collections.<Operand> emptyList(), null);
    }

    public static Terminator drop(Place p, int target) {
        return new Terminator(Kind.DROP, Collections.singletonList(target), null, p, Collections.<Operand> emptyList(),
                              null);
    }

    /**
     * @param func
     *            called function
     * @param args
     *            actual arguments
     * @param destination
     *            place receiving the result
     * @param target
     *            block to continue with, null if the callee never returns
     * @param cleanup
     *            block to unwind to, may be null
     * @return the call
     */
    public static Terminator call(Operand func, List<Operand> args, Place destination, Integer target,
                                  Integer cleanup) {
        List<Integer> t = target == null ? none() : Collections.singletonList(target);
        return new Terminator(Kind.CALL, t, func, destination, args, cleanup);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return normal successor blocks
     */
    public List<Integer> getTargets() {
        return targets;
    }

    /**
     * @return normal and unwind successor blocks
     */
    public List<Integer> getSuccessors() {
        if (cleanup == null) {
            return targets;
        }
        List<Integer> l = new ArrayList<>(targets);
        l.add(cleanup);
        return l;
    }

    public Operand getDiscriminant() {
        assert kind == Kind.SWITCH_INT;
        return operand;
    }

    public Operand getFunction() {
        assert kind == Kind.CALL;
        return operand;
    }

    public List<Operand> getArgs() {
        return args;
    }

    public Place getDestination() {
        assert kind == Kind.CALL;
        return place;
    }

    public Place getDroppedPlace() {
        assert kind == Kind.DROP;
        return place;
    }

    public Integer getCleanup() {
        return cleanup;
    }

    /**
     * @return the callee if this is a call to a statically named function with
     *         no dynamic dispatch, null otherwise
     */
    public ProcedureId getStaticCallee() {
        if (kind != Kind.CALL || operand.getKind() != Operand.Kind.FUNCTION || operand.isDynamic()) {
            return null;
        }
        return operand.getFunction();
    }

    @Override
    public String toString() {
        switch (kind) {
        case GOTO:
            return "goto bb" + targets.get(0);
        case SWITCH_INT:
            return "switchInt(" + operand + ") -> " + targets;
        case RETURN:
            return "return";
        case UNREACHABLE:
            return "unreachable";
        case DROP:
            return "drop(" + place + ") -> bb" + targets.get(0);
        case CALL:
            return place + " = " + operand + args + (targets.isEmpty() ? "" : " -> bb" + targets.get(0));
        default:
            throw new RuntimeException("Unknown terminator " + kind);
        }
    }
}
