package analysis.ir;

/**
 * Fully qualified name of a procedure, e.g. <code>crate::module::f</code>. The
 * part before the last <code>::</code> is the module the procedure is declared
 * in and determines which restricted fields it may see.
 */
public final class ProcedureId implements Comparable<ProcedureId> {

    /**
     * Path separator
     */
    public static final String SEPARATOR = "::";

    private final String path;

    private ProcedureId(String path) {
        this.path = path;
    }

    /**
     * Parse a fully qualified procedure name
     *
     * @param path
     *            qualified name, segments separated by "::"
     * @return the procedure identifier
     */
    public static ProcedureId parse(String path) {
        if (path == null || path.isEmpty() || path.startsWith(SEPARATOR) || path.endsWith(SEPARATOR)) {
            throw new IllegalArgumentException("Malformed procedure name: \"" + path + "\"");
        }
        return new ProcedureId(path);
    }

    /**
     * @return the qualified name
     */
    public String getPath() {
        return path;
    }

    /**
     * @return the unqualified name
     */
    public String getName() {
        int i = path.lastIndexOf(SEPARATOR);
        return i < 0 ? path : path.substring(i + SEPARATOR.length());
    }

    /**
     * @return the module the procedure is declared in, empty for the root module
     */
    public String getModulePath() {
        int i = path.lastIndexOf(SEPARATOR);
        return i < 0 ? "" : path.substring(0, i);
    }

    @Override
    public int compareTo(ProcedureId o) {
        return path.compareTo(o.path);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ProcedureId && ((ProcedureId) obj).path.equals(path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return path;
    }
}
