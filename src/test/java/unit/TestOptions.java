package unit;

import junit.framework.TestCase;
import main.InfoFlowAnalysisMain;
import main.InfoFlowAnalysisOptions;
import analysis.dataflow.interprocedural.infoflow.InfoFlowSettings;
import analysis.dataflow.interprocedural.pdg.CallSiteSensitive;
import analysis.dataflow.interprocedural.pdg.ContextInsensitive;
import analysis.ir.ProcedureId;

import com.beust.jcommander.ParameterException;

/**
 * Test the setting of options for the main method in
 * {@link InfoFlowAnalysisMain}
 */
public class TestOptions extends TestCase {

    public static void testOutputLevel() {
        String[] args = { "-output", "2" };
        InfoFlowAnalysisOptions o = InfoFlowAnalysisOptions.getOptions(args);
        assertEquals(2, o.getOutputLevel().intValue());

        String[] args2 = {};
        InfoFlowAnalysisOptions o2 = InfoFlowAnalysisOptions.getOptions(args2);
        assertEquals(0, o2.getOutputLevel().intValue());

        String[] args3 = { "-o", "4" };
        InfoFlowAnalysisOptions o3 = InfoFlowAnalysisOptions.getOptions(args3);
        assertEquals(4, o3.getOutputLevel().intValue());
        assertEquals(4, o3.getSettings().getOutputLevel());
    }

    public static void testEntryPoint() {
        String entry = "crate::main";
        String[] args = { "-entry", entry };
        InfoFlowAnalysisOptions o = InfoFlowAnalysisOptions.getOptions(args);
        assertEquals(ProcedureId.parse(entry), o.getEntryPoint());

        String[] args2 = { "-e", entry };
        InfoFlowAnalysisOptions o2 = InfoFlowAnalysisOptions.getOptions(args2);
        assertEquals(ProcedureId.parse(entry), o2.getEntryPoint());
    }

    public static void testNoEntryPoint() {
        String[] args = {};
        try {
            InfoFlowAnalysisOptions o = InfoFlowAnalysisOptions.getOptions(args);
            o.getEntryPoint();

        } catch (ParameterException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testProgram() {
        String[] args = { "-program", "prog.json" };
        InfoFlowAnalysisOptions o = InfoFlowAnalysisOptions.getOptions(args);
        assertEquals("prog.json", o.getProgram());

        String[] args2 = { "-p", "prog.json" };
        InfoFlowAnalysisOptions o2 = InfoFlowAnalysisOptions.getOptions(args2);
        assertEquals("prog.json", o2.getProgram());
    }

    public static void testNoProgram() {
        String[] args = {};
        try {
            InfoFlowAnalysisOptions o = InfoFlowAnalysisOptions.getOptions(args);
            o.getProgram();

        } catch (ParameterException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testPlaceDepth() {
        String[] args = { "-placeDepth", "2" };
        InfoFlowAnalysisOptions o = InfoFlowAnalysisOptions.getOptions(args);
        assertEquals(2, o.getSettings().getMaxPlaceDepth());

        String[] args2 = {};
        InfoFlowAnalysisOptions o2 = InfoFlowAnalysisOptions.getOptions(args2);
        assertEquals(InfoFlowSettings.DEFAULT_MAX_PLACE_DEPTH, o2.getSettings().getMaxPlaceDepth());
    }

    public static void testNegativePlaceDepth() {
        String[] args = { "-placeDepth", "-1" };
        try {
            InfoFlowAnalysisOptions.getOptions(args);
        } catch (ParameterException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testCallSiteSensitivity() {
        String[] args = {};
        InfoFlowAnalysisOptions o = InfoFlowAnalysisOptions.getOptions(args);
        assertTrue(o.getContextSelector() instanceof ContextInsensitive);

        String[] args2 = { "-cs", "2" };
        InfoFlowAnalysisOptions o2 = InfoFlowAnalysisOptions.getOptions(args2);
        assertTrue(o2.getContextSelector() instanceof CallSiteSensitive);
        assertEquals(2, ((CallSiteSensitive) o2.getContextSelector()).getSensitivity());

        String[] args3 = { "-callSiteSensitivity", "0" };
        InfoFlowAnalysisOptions o3 = InfoFlowAnalysisOptions.getOptions(args3);
        assertTrue(o3.getContextSelector() instanceof ContextInsensitive);
    }

    public static void testSkip() {
        String[] args = { "-skip", "std::io::read,std::io::write", "-skip", "crate::log" };
        InfoFlowAnalysisOptions o = InfoFlowAnalysisOptions.getOptions(args);
        assertEquals(3, o.getSkippedProcedures().size());
        assertTrue(o.getSkippedProcedures().contains(ProcedureId.parse("std::io::write")));
        assertTrue(o.getSkippedProcedures().contains(ProcedureId.parse("crate::log")));

        String[] args2 = {};
        InfoFlowAnalysisOptions o2 = InfoFlowAnalysisOptions.getOptions(args2);
        assertTrue(o2.getSkippedProcedures().isEmpty());
    }

    public static void testSettingsFlags() {
        String[] args = {};
        InfoFlowSettings s = InfoFlowAnalysisOptions.getOptions(args).getSettings();
        assertTrue(s.isRecurse());
        assertTrue(s.isControlDependencies());

        String[] args2 = { "-noRecurse", "-noControlDeps" };
        InfoFlowSettings s2 = InfoFlowAnalysisOptions.getOptions(args2).getSettings();
        assertFalse(s2.isRecurse());
        assertFalse(s2.isControlDependencies());
    }

    public static void testFlags() {
        String[] args = { "-writeDot", "-testMode", "-out", "graphs" };
        InfoFlowAnalysisOptions o = InfoFlowAnalysisOptions.getOptions(args);
        assertTrue(o.shouldWriteDot());
        assertTrue(o.isTestMode());
        assertEquals("graphs", o.getOutputDir());
        assertFalse(o.shouldPrintUsage());

        String[] args2 = { "-h" };
        InfoFlowAnalysisOptions o2 = InfoFlowAnalysisOptions.getOptions(args2);
        assertTrue(o2.shouldPrintUsage());
    }
}
