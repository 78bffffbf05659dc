package analysis.dataflow.interprocedural.pdg.graph.node;

import java.util.Collections;
import java.util.List;

import analysis.dataflow.interprocedural.pdg.CallContext;
import analysis.ir.ProcedureId;
import analysis.ir.Type;

/**
 * Identity of a node in the dependence graph: a procedure, the generic
 * arguments it was called with, and the context it was reached in
 */
public final class DependenceNodeKey {

    private final ProcedureId procedure;
    private final List<Type> instantiation;
    private final CallContext context;
    private final int memoizedHashCode;

    public DependenceNodeKey(ProcedureId procedure, List<Type> instantiation, CallContext context) {
        assert procedure != null;
        assert context != null;
        this.procedure = procedure;
        this.instantiation = instantiation == null ? Collections.<Type> emptyList() : Collections
                .unmodifiableList(instantiation);
        this.context = context;
        this.memoizedHashCode = computeHashCode();
    }

    public ProcedureId getProcedure() {
        return procedure;
    }

    public List<Type> getInstantiation() {
        return instantiation;
    }

    public CallContext getContext() {
        return context;
    }

    private int computeHashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + procedure.hashCode();
        result = prime * result + instantiation.hashCode();
        result = prime * result + context.hashCode();
        return result;
    }

    @Override
    public int hashCode() {
        return memoizedHashCode;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        DependenceNodeKey other = (DependenceNodeKey) obj;
        return procedure.equals(other.procedure) && instantiation.equals(other.instantiation)
                && context.equals(other.context);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(procedure.toString());
        if (!instantiation.isEmpty()) {
            sb.append("::<");
            for (int i = 0; i < instantiation.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(instantiation.get(i));
            }
            sb.append(">");
        }
        if (context.size() > 0) {
            sb.append(" ").append(context);
        }
        return sb.toString();
    }
}
