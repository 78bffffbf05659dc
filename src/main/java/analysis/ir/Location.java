package analysis.ir;

/**
 * Program point within one procedure: a statement or terminator of a basic
 * block, or the pseudo-point at which the caller supplies an argument. The
 * terminator of a block is at statement index
 * <code>block.getStatements().size()</code>.
 */
public final class Location implements Comparable<Location> {

    /**
     * Block of argument pseudo-points
     */
    private static final int ARGUMENT_BLOCK = -1;

    private final int block;
    /**
     * Statement index, or the argument local for argument pseudo-points
     */
    private final int statement;

    private Location(int block, int statement) {
        this.block = block;
        this.statement = statement;
    }

    /**
     * @param block
     *            basic block index
     * @param statement
     *            index of the statement in the block
     * @return the location
     */
    public static Location make(int block, int statement) {
        if (block < 0 || statement < 0) {
            throw new IllegalArgumentException("Invalid location bb" + block + "[" + statement + "]");
        }
        return new Location(block, statement);
    }

    /**
     * @param local
     *            formal parameter local (1 to the argument count)
     * @return pseudo-point for the value of the argument on entry
     */
    public static Location argument(int local) {
        if (local < 1) {
            throw new IllegalArgumentException("Argument locals start at 1, got " + local);
        }
        return new Location(ARGUMENT_BLOCK, local);
    }

    public boolean isArgument() {
        return block == ARGUMENT_BLOCK;
    }

    public int getBlock() {
        assert !isArgument();
        return block;
    }

    public int getStatementIndex() {
        assert !isArgument();
        return statement;
    }

    /**
     * @return local of an argument pseudo-point
     */
    public int getArgumentLocal() {
        assert isArgument();
        return statement;
    }

    @Override
    public int compareTo(Location o) {
        if (block != o.block) {
            return block < o.block ? -1 : 1;
        }
        return Integer.compare(statement, o.statement);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Location)) {
            return false;
        }
        Location other = (Location) obj;
        return block == other.block && statement == other.statement;
    }

    @Override
    public int hashCode() {
        return 31 * block + statement;
    }

    @Override
    public String toString() {
        if (isArgument()) {
            return "arg_" + statement;
        }
        return "bb" + block + "[" + statement + "]";
    }

    /**
     * Parse the string form produced by {@link #toString()}
     *
     * @param s
     *            string such as <code>bb2[0]</code> or <code>arg_1</code>
     * @return the location
     */
    public static Location parse(String s) {
        try {
            if (s.startsWith("arg_")) {
                return argument(Integer.parseInt(s.substring(4)));
            }
            if (s.startsWith("bb") && s.endsWith("]")) {
                int open = s.indexOf('[');
                return make(Integer.parseInt(s.substring(2, open)), Integer.parseInt(s.substring(open + 1,
                                                                                                   s.length() - 1)));
            }
        }
        catch (NumberFormatException | StringIndexOutOfBoundsException e) {
            throw new IllegalArgumentException("Malformed location \"" + s + "\"", e);
        }
        throw new IllegalArgumentException("Malformed location \"" + s + "\"");
    }
}
