package analysis.dataflow.interprocedural.infoflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import analysis.ir.Place;

/**
 * One write performed by an instruction, together with the places whose
 * values influenced it
 */
public final class Mutation {

    private final Place mutated;
    private final List<Place> inputs;
    private final MutationReason reason;
    private final MutationStatus status;

    public Mutation(Place mutated, List<Place> inputs, MutationReason reason, MutationStatus status) {
        this.mutated = mutated;
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.reason = reason;
        this.status = status;
    }

    public Place getMutated() {
        return mutated;
    }

    public List<Place> getInputs() {
        return inputs;
    }

    public MutationReason getReason() {
        return reason;
    }

    public MutationStatus getStatus() {
        return status;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Mutation)) {
            return false;
        }
        Mutation other = (Mutation) obj;
        return mutated.equals(other.mutated) && inputs.equals(other.inputs) && reason.equals(other.reason)
                && status == other.status;
    }

    @Override
    public int hashCode() {
        return ((mutated.hashCode() * 31 + inputs.hashCode()) * 31 + reason.hashCode()) * 31 + status.hashCode();
    }

    @Override
    public String toString() {
        return mutated + " <- " + inputs + " (" + reason + ", " + status + ")";
    }
}
