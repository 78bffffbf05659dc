package analysis.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Straight-line sequence of statements ended by a terminator
 */
public final class BasicBlock {

    private final List<Statement> statements;
    private final Terminator terminator;

    public BasicBlock(List<Statement> statements, Terminator terminator) {
        if (terminator == null) {
            throw new IllegalArgumentException("Basic block without a terminator");
        }
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
        this.terminator = terminator;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public Terminator getTerminator() {
        return terminator;
    }

    /**
     * @return statement index of the terminator
     */
    public int getTerminatorIndex() {
        return statements.size();
    }
}
