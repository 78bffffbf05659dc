package analysis.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Declared parameter and return types of a procedure, possibly generic
 */
public final class ProcedureSignature {

    private final ProcedureId id;
    private final List<String> typeParameters;
    private final List<Type> parameterTypes;
    private final Type returnType;

    public ProcedureSignature(ProcedureId id, List<String> typeParameters, List<Type> parameterTypes, Type returnType) {
        this.id = id;
        this.typeParameters = Collections.unmodifiableList(new ArrayList<>(typeParameters));
        this.parameterTypes = Collections.unmodifiableList(new ArrayList<>(parameterTypes));
        this.returnType = returnType;
    }

    public ProcedureId getId() {
        return id;
    }

    public List<String> getTypeParameters() {
        return typeParameters;
    }

    public List<Type> getParameterTypes() {
        return parameterTypes;
    }

    public Type getReturnType() {
        return returnType;
    }

    /**
     * @param instantiation
     *            generic arguments, may be shorter than the parameter list
     * @return the return type with the generic arguments substituted
     */
    public Type getReturnType(List<Type> instantiation) {
        Map<String, Type> m = new HashMap<>();
        for (int i = 0; i < typeParameters.size() && i < instantiation.size(); i++) {
            m.put(typeParameters.get(i), instantiation.get(i));
        }
        return returnType.substitute(m);
    }

    @Override
    public String toString() {
        return "fn " + id + (typeParameters.isEmpty() ? "" : "<" + typeParameters + ">") + parameterTypes + " -> "
                + returnType;
    }
}
