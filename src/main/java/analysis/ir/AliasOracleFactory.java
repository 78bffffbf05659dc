package analysis.ir;

/**
 * Creates the alias oracle for a procedure body
 */
public interface AliasOracleFactory {

    /**
     * @param body
     *            procedure to analyze
     * @param types
     *            type oracle for projections
     * @return alias information for the body
     */
    AliasOracle build(Procedure body, TypeOracle types);
}
