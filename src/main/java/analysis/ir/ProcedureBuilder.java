package analysis.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Incrementally builds a {@link Procedure}. Block 0 exists from the start and
 * is the current block. Arguments must be declared before any other local.
 */
public class ProcedureBuilder {

    private final ProcedureId id;
    private ProcedureKind kind = ProcedureKind.FN;
    private final List<LocalDecl> locals = new ArrayList<>();
    private int argCount = 0;
    private final List<String> typeParameters = new ArrayList<>();
    private final List<List<Statement>> statements = new ArrayList<>();
    private final List<Terminator> terminators = new ArrayList<>();
    private boolean hasUnsafe = false;
    private int current = 0;

    /**
     * @param id
     *            qualified procedure name
     * @param returnType
     *            type of local 0
     */
    public ProcedureBuilder(String id, Type returnType) {
        this(ProcedureId.parse(id), returnType);
    }

    public ProcedureBuilder(ProcedureId id, Type returnType) {
        this.id = id;
        this.locals.add(new LocalDecl(returnType, null));
        newBlock();
    }

    public ProcedureBuilder kind(ProcedureKind k) {
        this.kind = k;
        return this;
    }

    public ProcedureBuilder typeParameter(String name) {
        typeParameters.add(name);
        return this;
    }

    /**
     * Mark the body as containing unsafe code
     *
     * @return this builder
     */
    public ProcedureBuilder unsafe() {
        this.hasUnsafe = true;
        return this;
    }

    /**
     * @param name
     *            parameter name
     * @param type
     *            parameter type
     * @return local index of the new parameter
     */
    public int arg(String name, Type type) {
        if (locals.size() != argCount + 1) {
            throw new IllegalStateException("Arguments of " + id + " must be declared before other locals");
        }
        locals.add(new LocalDecl(type, name));
        argCount++;
        return locals.size() - 1;
    }

    /**
     * @param name
     *            variable name, may be null
     * @param type
     *            type of the local
     * @return index of the new local
     */
    public int local(String name, Type type) {
        locals.add(new LocalDecl(type, name));
        return locals.size() - 1;
    }

    /**
     * @return index of a fresh empty block, the current block is unchanged
     */
    public int newBlock() {
        statements.add(new ArrayList<Statement>());
        terminators.add(null);
        return statements.size() - 1;
    }

    /**
     * @param b
     *            block to append to from now on
     * @return this builder
     */
    public ProcedureBuilder atBlock(int b) {
        if (b < 0 || b >= statements.size()) {
            throw new IllegalArgumentException("No block bb" + b);
        }
        current = b;
        return this;
    }

    public int getCurrentBlock() {
        return current;
    }

    /**
     * @param s
     *            statement to append to the current block
     * @return location of the statement
     */
    public Location add(Statement s) {
        if (terminators.get(current) != null) {
            throw new IllegalStateException("bb" + current + " of " + id + " is already terminated");
        }
        List<Statement> l = statements.get(current);
        l.add(s);
        return Location.make(current, l.size() - 1);
    }

    public Location assign(Place p, Rvalue rv) {
        return add(Statement.assign(p, rv));
    }

    /**
     * @param t
     *            terminator of the current block
     * @return location of the terminator
     */
    public Location terminate(Terminator t) {
        if (terminators.get(current) != null) {
            throw new IllegalStateException("bb" + current + " of " + id + " is already terminated");
        }
        terminators.set(current, t);
        return Location.make(current, statements.get(current).size());
    }

    /**
     * @return location of the new return terminator
     */
    public Location ret() {
        return terminate(Terminator.ret());
    }

    /**
     * Terminate the current block with a call to a statically named function
     * and continue in a fresh block
     *
     * @param callee
     *            called procedure
     * @param destination
     *            place receiving the result
     * @param args
     *            actual arguments
     * @return location of the call
     */
    public Location call(ProcedureId callee, Place destination, Operand... args) {
        return call(Operand.function(callee, Collections.<Type> emptyList()), destination, Arrays.asList(args));
    }

    /**
     * Terminate the current block with a call and continue in a fresh block
     *
     * @param func
     *            called function
     * @param destination
     *            place receiving the result
     * @param args
     *            actual arguments
     * @return location of the call
     */
    public Location call(Operand func, Place destination, List<Operand> args) {
        int next = newBlock();
        Location l = terminate(Terminator.call(func, args, destination, next, null));
        current = next;
        return l;
    }

    /**
     * @return the procedure
     * @throws IllegalStateException
     *             if a block has no terminator
     */
    public Procedure build() {
        List<BasicBlock> blocks = new ArrayList<>(statements.size());
        for (int b = 0; b < statements.size(); b++) {
            if (terminators.get(b) == null) {
                throw new IllegalStateException("bb" + b + " of " + id + " has no terminator");
            }
            blocks.add(new BasicBlock(statements.get(b), terminators.get(b)));
        }
        return new Procedure(id, kind, argCount, typeParameters, locals, blocks, hasUnsafe);
    }
}
