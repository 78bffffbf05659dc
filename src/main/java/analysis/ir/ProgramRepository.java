package analysis.ir;

import java.util.Collection;

/**
 * Provides procedure bodies and signatures for the program being analyzed
 */
public interface ProgramRepository {

    /**
     * @param id
     *            procedure identifier
     * @return the body of the procedure, or null if it is not defined in the
     *         analyzed program (for example a library procedure)
     */
    Procedure getBody(ProcedureId id);

    /**
     * @param id
     *            procedure identifier
     * @return the signature of the procedure, or null if it is unknown
     */
    ProcedureSignature getSignature(ProcedureId id);

    /**
     * @return identifiers of every procedure with a body
     */
    Collection<ProcedureId> getLocalProcedures();
}
