package analysis.ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Body of a procedure: its locals and control-flow graph. Local 0 holds the
 * return value, locals 1 to {@link #getArgCount()} are the formal parameters.
 * Block 0 is the entry block.
 */
public final class Procedure {

    private final ProcedureId id;
    private final ProcedureKind kind;
    private final int argCount;
    private final List<String> typeParameters;
    private final List<LocalDecl> locals;
    private final List<BasicBlock> blocks;
    private final boolean hasUnsafeBlocks;

    /**
     * Lazily computed predecessor lists
     */
    private List<List<Integer>> predecessors;
    /**
     * Lazily computed reverse postorder of the blocks
     */
    private List<Integer> reversePostorder;

    public Procedure(ProcedureId id, ProcedureKind kind, int argCount, List<String> typeParameters,
                     List<LocalDecl> locals, List<BasicBlock> blocks, boolean hasUnsafeBlocks) {
        if (locals.size() < argCount + 1) {
            throw new IllegalArgumentException(id + " declares " + argCount + " arguments but only " + locals.size()
                    + " locals");
        }
        if (blocks.isEmpty()) {
            throw new IllegalArgumentException(id + " has no basic blocks");
        }
        this.id = id;
        this.kind = kind;
        this.argCount = argCount;
        this.typeParameters = Collections.unmodifiableList(new ArrayList<>(typeParameters));
        this.locals = Collections.unmodifiableList(new ArrayList<>(locals));
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
        this.hasUnsafeBlocks = hasUnsafeBlocks;
        for (int b = 0; b < blocks.size(); b++) {
            for (int s : blocks.get(b).getTerminator().getSuccessors()) {
                if (s < 0 || s >= blocks.size()) {
                    throw new IllegalArgumentException(id + ": bb" + b + " jumps to missing block bb" + s);
                }
            }
        }
    }

    public ProcedureId getId() {
        return id;
    }

    public ProcedureKind getKind() {
        return kind;
    }

    public int getArgCount() {
        return argCount;
    }

    public List<String> getTypeParameters() {
        return typeParameters;
    }

    public List<LocalDecl> getLocals() {
        return locals;
    }

    public int getNumLocals() {
        return locals.size();
    }

    /**
     * @param local
     *            local index
     * @return declared type of the local
     * @throws IllegalArgumentException
     *             if the procedure has no such local
     */
    public Type getLocalType(int local) {
        if (local < 0 || local >= locals.size()) {
            throw new IllegalArgumentException("Local _" + local + " out of range for " + id + " with "
                    + locals.size() + " locals");
        }
        return locals.get(local).getType();
    }

    public Type getReturnType() {
        return locals.get(0).getType();
    }

    public List<BasicBlock> getBlocks() {
        return blocks;
    }

    public BasicBlock getBlock(int b) {
        if (b < 0 || b >= blocks.size()) {
            throw new IllegalArgumentException("Block bb" + b + " out of range for " + id);
        }
        return blocks.get(b);
    }

    public boolean hasUnsafeBlocks() {
        return hasUnsafeBlocks;
    }

    /**
     * @return the declared signature of this body
     */
    public ProcedureSignature getSignature() {
        List<Type> params = new ArrayList<>(argCount);
        for (int i = 1; i <= argCount; i++) {
            params.add(getLocalType(i));
        }
        return new ProcedureSignature(id, typeParameters, params, getReturnType());
    }

    /**
     * @return argument pseudo-points followed by every statement and terminator
     */
    public List<Location> getAllLocations() {
        List<Location> l = new ArrayList<>();
        for (int i = 1; i <= argCount; i++) {
            l.add(Location.argument(i));
        }
        for (int b = 0; b < blocks.size(); b++) {
            for (int s = 0; s <= blocks.get(b).getTerminatorIndex(); s++) {
                l.add(Location.make(b, s));
            }
        }
        return l;
    }

    /**
     * @return the locations of every return terminator
     */
    public List<Location> getReturnLocations() {
        List<Location> l = new ArrayList<>();
        for (int b = 0; b < blocks.size(); b++) {
            BasicBlock bb = blocks.get(b);
            if (bb.getTerminator().getKind() == Terminator.Kind.RETURN) {
                l.add(Location.make(b, bb.getTerminatorIndex()));
            }
        }
        return l;
    }

    /**
     * @param loc
     *            location in this procedure
     * @return the statement at the location, null if it is a terminator
     */
    public Statement getStatement(Location loc) {
        BasicBlock bb = getBlock(loc.getBlock());
        if (loc.getStatementIndex() == bb.getTerminatorIndex()) {
            return null;
        }
        if (loc.getStatementIndex() > bb.getTerminatorIndex()) {
            throw new IllegalArgumentException("Location " + loc + " out of range for " + id);
        }
        return bb.getStatements().get(loc.getStatementIndex());
    }

    /**
     * @param loc
     *            location in this procedure
     * @return the terminator at the location, null if it is a statement
     */
    public Terminator getTerminator(Location loc) {
        BasicBlock bb = getBlock(loc.getBlock());
        return loc.getStatementIndex() == bb.getTerminatorIndex() ? bb.getTerminator() : null;
    }

    /**
     * @param b
     *            block index
     * @return location of the block's terminator
     */
    public Location getTerminatorLocation(int b) {
        return Location.make(b, getBlock(b).getTerminatorIndex());
    }

    /**
     * @param b
     *            block index
     * @return blocks that can jump to the block
     */
    public List<Integer> getPredecessors(int b) {
        if (predecessors == null) {
            List<List<Integer>> preds = new ArrayList<>(blocks.size());
            for (int i = 0; i < blocks.size(); i++) {
                preds.add(new ArrayList<Integer>());
            }
            for (int i = 0; i < blocks.size(); i++) {
                for (int s : blocks.get(i).getTerminator().getSuccessors()) {
                    if (!preds.get(s).contains(i)) {
                        preds.get(s).add(i);
                    }
                }
            }
            predecessors = preds;
        }
        return Collections.unmodifiableList(predecessors.get(b));
    }

    /**
     * @return blocks reachable from the entry in reverse postorder, followed by
     *         the unreachable blocks
     */
    public List<Integer> getReversePostorder() {
        if (reversePostorder == null) {
            boolean[] visited = new boolean[blocks.size()];
            List<Integer> postorder = new ArrayList<>(blocks.size());
            // stack of (block, next successor index)
            Deque<int[]> stack = new ArrayDeque<>();
            stack.push(new int[] { 0, 0 });
            visited[0] = true;
            while (!stack.isEmpty()) {
                int[] top = stack.peek();
                List<Integer> succs = blocks.get(top[0]).getTerminator().getSuccessors();
                if (top[1] < succs.size()) {
                    int s = succs.get(top[1]++);
                    if (!visited[s]) {
                        visited[s] = true;
                        stack.push(new int[] { s, 0 });
                    }
                }
                else {
                    postorder.add(stack.pop()[0]);
                }
            }
            Collections.reverse(postorder);
            for (int b = 0; b < blocks.size(); b++) {
                if (!visited[b]) {
                    postorder.add(b);
                }
            }
            reversePostorder = Collections.unmodifiableList(postorder);
        }
        return reversePostorder;
    }

    /**
     * Check that a place belongs to this procedure
     *
     * @param p
     *            place to check
     * @throws IllegalArgumentException
     *             if the place's local or an index local is out of range
     */
    public void checkPlace(Place p) {
        getLocalType(p.getLocal());
        for (ProjectionElem e : p.getProjection()) {
            if (e.getKind() == ProjectionElem.Kind.INDEX) {
                getLocalType(e.getIndexLocal());
            }
        }
    }

    @Override
    public String toString() {
        return id.toString();
    }
}
