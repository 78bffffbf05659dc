package main;

import java.io.BufferedOutputStream;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.FileWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import org.json.JSONException;

import analysis.dataflow.interprocedural.infoflow.ScopeReport;
import analysis.dataflow.interprocedural.pdg.CallChangeCallback;
import analysis.dataflow.interprocedural.pdg.DependenceGraphConstructor;
import analysis.dataflow.interprocedural.pdg.DependenceGraphParams;
import analysis.dataflow.interprocedural.pdg.SkipProceduresCallback;
import analysis.dataflow.interprocedural.pdg.UnwrapAsyncCallback;
import analysis.dataflow.interprocedural.pdg.graph.DependenceGraph;
import analysis.ir.InMemoryProgram;
import analysis.ir.ProcedureId;
import analysis.ir.StructuralTypeOracle;
import analysis.ir.serialization.ProgramJSONReader;

import com.beust.jcommander.ParameterException;

/**
 * Build the dependence graph of a procedure of a program read from JSON, see
 * usage
 */
public class InfoFlowAnalysisMain {

    /**
     * Run the analysis
     *
     * @param args
     *            options and parameters see usage (pass in "-h") for details
     * @throws IOException
     *             file reading or writing issues
     * @throws JSONException
     *             issues reading the program or writing the JSON file
     */
    public static void main(String[] args) throws IOException, JSONException {
        InfoFlowAnalysisOptions options;
        try {
            options = InfoFlowAnalysisOptions.getOptions(args);
        }
        catch (ParameterException e) {
            System.err.println(e.getMessage());
            System.err.println(InfoFlowAnalysisOptions.getUsage());
            System.exit(1);
            return;
        }
        if (options.shouldPrintUsage()) {
            System.err.println(InfoFlowAnalysisOptions.getUsage());
            return;
        }

        int outputLevel = options.getOutputLevel();
        ProcedureId entry;
        String programFile;
        try {
            entry = options.getEntryPoint();
            programFile = options.getProgram();
        }
        catch (ParameterException e) {
            System.err.println(e.getMessage());
            System.err.println(InfoFlowAnalysisOptions.getUsage());
            System.exit(1);
            return;
        }

        InMemoryProgram program = ProgramJSONReader.read(Paths.get(programFile));
        if (outputLevel >= 1) {
            System.err.println("Read " + program.getLocalProcedures().size() + " procedures from " + programFile);
        }

        CallChangeCallback callback = new UnwrapAsyncCallback();
        List<ProcedureId> skipped = options.getSkippedProcedures();
        if (!skipped.isEmpty()) {
            callback = new SkipProceduresCallback(skipped, callback);
        }
        DependenceGraphParams params = new DependenceGraphParams(program, new StructuralTypeOracle(), entry)
                .setSettings(options.getSettings()).setContextSelector(options.getContextSelector())
                .setCallback(callback);

        DependenceGraphConstructor constructor = new DependenceGraphConstructor(params);
        DependenceGraph g = constructor.construct();
        if (outputLevel >= 1) {
            g.printDetailedCounts();
        }
        else {
            g.printSimpleCounts();
        }
        ScopeReport report = constructor.getScopeReport();
        System.err.println(report);

        if (options.isTestMode()) {
            // Don't print files in test mode
            return;
        }

        String outputDir = options.getOutputDir();
        new File(outputDir).mkdirs();
        String fileName = entry.toString().replace(ProcedureId.SEPARATOR, "_");
        String fullName = outputDir + "/pdg_" + fileName + ".json";
        GZIPOutputStream gzip = new GZIPOutputStream(new BufferedOutputStream(new FileOutputStream(fullName + ".gz")));
        try (Writer writer = new BufferedWriter(new OutputStreamWriter(gzip, StandardCharsets.UTF_8))) {
            g.writeJSON(writer);
            System.err.println("JSON written to " + fullName + ".gz");
        }

        if (options.shouldWriteDot()) {
            String dotName = outputDir + "/pdg_" + fileName + ".dot";
            try (Writer writer = new FileWriter(dotName)) {
                g.writeDot(writer, true, 1);
                System.err.println("DOT written to " + dotName);
            }
        }
    }
}
