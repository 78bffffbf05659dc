package analysis.ir;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Program repository holding explicitly registered bodies and signatures
 */
public class InMemoryProgram implements ProgramRepository {

    private final Map<ProcedureId, Procedure> bodies = new LinkedHashMap<>();
    /**
     * Signatures of procedures without a body
     */
    private final Map<ProcedureId, ProcedureSignature> external = new LinkedHashMap<>();

    /**
     * @param body
     *            procedure body to add
     * @return this program
     */
    public InMemoryProgram add(Procedure body) {
        if (bodies.containsKey(body.getId()) || external.containsKey(body.getId())) {
            throw new IllegalArgumentException("Duplicate procedure " + body.getId());
        }
        bodies.put(body.getId(), body);
        return this;
    }

    /**
     * @param sig
     *            signature of a procedure defined outside the analyzed program
     * @return this program
     */
    public InMemoryProgram addExternal(ProcedureSignature sig) {
        if (bodies.containsKey(sig.getId()) || external.containsKey(sig.getId())) {
            throw new IllegalArgumentException("Duplicate procedure " + sig.getId());
        }
        external.put(sig.getId(), sig);
        return this;
    }

    @Override
    public Procedure getBody(ProcedureId id) {
        return bodies.get(id);
    }

    @Override
    public ProcedureSignature getSignature(ProcedureId id) {
        Procedure p = bodies.get(id);
        if (p != null) {
            return p.getSignature();
        }
        return external.get(id);
    }

    @Override
    public Collection<ProcedureId> getLocalProcedures() {
        return Collections.unmodifiableSet(bodies.keySet());
    }

    /**
     * @return signatures of the procedures without bodies
     */
    public Collection<ProcedureSignature> getExternalSignatures() {
        return Collections.unmodifiableCollection(external.values());
    }
}
