package analysis.ir;

/**
 * Where a field may be accessed from
 */
public final class Visibility {

    /**
     * Visible everywhere
     */
    public static final Visibility PUBLIC = new Visibility(null);

    /**
     * Module the field is restricted to, null if public
     */
    private final String module;

    private Visibility(String module) {
        this.module = module;
    }

    /**
     * @param module
     *            module path, e.g. <code>crate::shapes</code>
     * @return visibility restricted to the module and its submodules
     */
    public static Visibility restricted(String module) {
        if (module == null) {
            throw new IllegalArgumentException("Restricted visibility needs a module");
        }
        return new Visibility(module);
    }

    public boolean isPublic() {
        return module == null;
    }

    /**
     * @return module the field is restricted to, null if public
     */
    public String getModule() {
        return module;
    }

    /**
     * @param scope
     *            module of the accessing code
     * @return true if code in the scope may access the field
     */
    public boolean isAccessibleFrom(String scope) {
        if (module == null) {
            return true;
        }
        return scope.equals(module) || scope.startsWith(module + ProcedureId.SEPARATOR);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Visibility)) {
            return false;
        }
        Visibility other = (Visibility) obj;
        return module == null ? other.module == null : module.equals(other.module);
    }

    @Override
    public int hashCode() {
        return module == null ? 0 : module.hashCode();
    }

    @Override
    public String toString() {
        return module == null ? "pub" : "pub(in " + module + ")";
    }
}
