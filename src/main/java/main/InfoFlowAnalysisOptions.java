package main;

import java.util.ArrayList;
import java.util.List;

import analysis.dataflow.interprocedural.infoflow.InfoFlowSettings;
import analysis.dataflow.interprocedural.pdg.CallContextSelector;
import analysis.dataflow.interprocedural.pdg.CallSiteSensitive;
import analysis.dataflow.interprocedural.pdg.ContextInsensitive;
import analysis.ir.ProcedureId;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

public final class InfoFlowAnalysisOptions {

    /**
     * Output folder default is "tests"
     */
    @Parameter(names = { "-out" }, description = "Output directory, default is the tests directory.")
    private String outputDir = "tests";

    /**
     * Flag for printing usage information
     */
    @Parameter(names = { "-h", "-help", "-usage", "--help" }, description = "Print usage information")
    private boolean help = false;

    /**
     * Level of output
     */
    @Parameter(names = { "-output", "-o" }, description = "Level of output (higher means more console output)")
    private Integer outputLevel = 0;

    /**
     * JSON file containing the program to analyze
     */
    @Parameter(names = { "-p", "-program" }, description = "JSON file containing the program to analyze")
    private String program;

    /**
     * Root procedure
     */
    @Parameter(names = { "-e", "-entry" }, description = "The procedure to build the dependence graph for, written as a path with segments separated by :: (e.g. crate::main)")
    private String entryPoint;

    @Parameter(names = { "-noRecurse" }, description = "If set, calls are never analyzed, every call is treated conservatively")
    private boolean noRecurse = false;

    @Parameter(names = { "-noControlDeps" }, description = "If set, mutations do not depend on the branches that control them")
    private boolean noControlDeps = false;

    @Parameter(names = { "-placeDepth" }, validateWith = InfoFlowAnalysisOptions.NonNegativeValidator.class, description = "Depth to which values are expanded into their fields")
    private Integer placeDepth = InfoFlowSettings.DEFAULT_MAX_PLACE_DEPTH;

    @Parameter(names = { "-cs", "-callSiteSensitivity" }, validateWith = InfoFlowAnalysisOptions.NonNegativeValidator.class, description = "Number of call sites distinguishing graph nodes for the same procedure, 0 for one node per procedure and instantiation")
    private Integer callSiteSensitivity = 0;

    /**
     * Flag for writing the graph to a graphviz "dot" file as well as a JSON
     * file
     */
    @Parameter(names = { "-writeDot" }, description = "If set, write a graphviz .dot file for the dependence graph in addition to a JSON file")
    private boolean writeDot = false;

    @Parameter(names = { "-skip" }, description = "Procedures whose calls are never analyzed (comma separated or repeated)")
    private List<String> skip = new ArrayList<>();

    /**
     * If set no files are written
     */
    @Parameter(names = { "-testMode" }, description = "If set, print results but do not write any files")
    private boolean testMode = false;

    /**
     * Validate integer options that must not be negative
     */
    public static class NonNegativeValidator implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            int i;
            try {
                i = Integer.parseInt(value);
            }
            catch (NumberFormatException e) {
                throw new ParameterException("Parameter " + name + " should be an integer (found " + value + ")");
            }
            if (i < 0) {
                throw new ParameterException("Parameter " + name + " should not be negative (found " + value + ")");
            }
        }
    }

    private InfoFlowAnalysisOptions() {
        // Do not instantiate
    }

    /**
     * Parse the options for the given args
     *
     * @param args
     *            arguments to parse
     * @return Options object with the parsed options available via getters
     */
    public static InfoFlowAnalysisOptions getOptions(String[] args) {
        InfoFlowAnalysisOptions o = new InfoFlowAnalysisOptions();
        JCommander jc = new JCommander();
        jc.addObject(o);
        jc.parse(args);
        return o;
    }

    public static String getUsage() {
        StringBuilder sb = new StringBuilder();
        InfoFlowAnalysisOptions o = new InfoFlowAnalysisOptions();
        JCommander jc = new JCommander();
        jc.addObject(o);
        jc.setProgramName("InfoFlowAnalysisMain");
        jc.getUsageFormatter().usage(sb);
        return sb.toString();
    }

    /**
     * Should we print the usage information
     *
     * @return true if we should print usage
     */
    public boolean shouldPrintUsage() {
        return help;
    }

    public Integer getOutputLevel() {
        return outputLevel;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public String getProgram() {
        if (program == null) {
            throw new ParameterException("Must specify a program file.");
        }
        return program;
    }

    public ProcedureId getEntryPoint() {
        if (entryPoint == null) {
            throw new ParameterException("Must specify an entry point.");
        }
        return ProcedureId.parse(entryPoint);
    }

    public List<ProcedureId> getSkippedProcedures() {
        List<ProcedureId> l = new ArrayList<>();
        for (String s : skip) {
            l.add(ProcedureId.parse(s.trim()));
        }
        return l;
    }

    public boolean shouldWriteDot() {
        return writeDot;
    }

    public boolean isTestMode() {
        return testMode;
    }

    /**
     * @return analysis settings for the options
     */
    public InfoFlowSettings getSettings() {
        return new InfoFlowSettings().setRecurse(!noRecurse).setControlDependencies(!noControlDeps)
                                     .setMaxPlaceDepth(placeDepth).setOutputLevel(outputLevel);
    }

    /**
     * @return the context selector for the requested call site sensitivity
     */
    public CallContextSelector getContextSelector() {
        if (callSiteSensitivity == 0) {
            return new ContextInsensitive();
        }
        return new CallSiteSensitive(callSiteSensitivity);
    }
}
