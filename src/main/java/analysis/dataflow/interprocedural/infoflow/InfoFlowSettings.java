package analysis.dataflow.interprocedural.infoflow;

/**
 * Options for the dependency analysis
 */
public class InfoFlowSettings {

    /**
     * Default depth to which values are expanded into their fields
     */
    public static final int DEFAULT_MAX_PLACE_DEPTH = 4;

    private boolean recurse = true;
    private boolean controlDependencies = true;
    private int maxPlaceDepth = DEFAULT_MAX_PLACE_DEPTH;
    private int outputLevel = 0;

    /**
     * @return true if callees with bodies are analyzed and summarized
     */
    public boolean isRecurse() {
        return recurse;
    }

    public InfoFlowSettings setRecurse(boolean recurse) {
        this.recurse = recurse;
        return this;
    }

    /**
     * @return true if mutations also depend on the branches that control them
     */
    public boolean isControlDependencies() {
        return controlDependencies;
    }

    public InfoFlowSettings setControlDependencies(boolean controlDependencies) {
        this.controlDependencies = controlDependencies;
        return this;
    }

    public int getMaxPlaceDepth() {
        return maxPlaceDepth;
    }

    public InfoFlowSettings setMaxPlaceDepth(int maxPlaceDepth) {
        if (maxPlaceDepth < 0) {
            throw new IllegalArgumentException("Negative place depth " + maxPlaceDepth);
        }
        this.maxPlaceDepth = maxPlaceDepth;
        return this;
    }

    /**
     * @return how much to print to System.err, 0 for nothing
     */
    public int getOutputLevel() {
        return outputLevel;
    }

    public InfoFlowSettings setOutputLevel(int outputLevel) {
        this.outputLevel = outputLevel;
        return this;
    }

    @Override
    public String toString() {
        return "recurse=" + recurse + " controlDependencies=" + controlDependencies + " maxPlaceDepth="
                + maxPlaceDepth + " outputLevel=" + outputLevel;
    }
}
