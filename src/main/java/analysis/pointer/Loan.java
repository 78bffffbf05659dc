package analysis.pointer;

import analysis.ir.Mutability;
import analysis.ir.Place;

/**
 * A borrow carried by a pointer: the borrowed place and whether the borrow
 * permits writes
 */
public final class Loan {

    private final Place borrowed;
    private final Mutability mutability;

    public Loan(Place borrowed, Mutability mutability) {
        assert borrowed != null && mutability != null;
        this.borrowed = borrowed;
        this.mutability = mutability;
    }

    public Place getBorrowed() {
        return borrowed;
    }

    public Mutability getMutability() {
        return mutability;
    }

    /**
     * @param requested
     *            access through the pointer
     * @return true if the borrow allows the requested access
     */
    public boolean permits(Mutability requested) {
        return mutability.permits(requested);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Loan)) {
            return false;
        }
        Loan other = (Loan) obj;
        return mutability == other.mutability && borrowed.equals(other.borrowed);
    }

    @Override
    public int hashCode() {
        return 31 * borrowed.hashCode() + mutability.hashCode();
    }

    @Override
    public String toString() {
        return (mutability == Mutability.MUT ? "&mut " : "&") + borrowed;
    }
}
