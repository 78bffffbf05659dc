package analysis.dataflow.interprocedural.pdg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import analysis.dataflow.interprocedural.infoflow.InfoFlowSettings;
import analysis.ir.AliasOracleFactory;
import analysis.ir.ProcedureId;
import analysis.ir.ProgramRepository;
import analysis.ir.Type;
import analysis.ir.TypeOracle;
import analysis.pointer.BorrowPointsToAnalysis;

/**
 * Inputs of a dependence graph construction. Everything but the program, the
 * type oracle and the root has a default.
 */
public class DependenceGraphParams {

    private final ProgramRepository program;
    private final TypeOracle types;
    private final ProcedureId root;
    private List<Type> rootInstantiation = Collections.emptyList();
    private CallChangeCallback callback = new UnwrapAsyncCallback();
    private CallContextSelector contextSelector = new ContextInsensitive();
    private InfoFlowSettings settings = new InfoFlowSettings();
    /**
     * null to use a {@link BorrowPointsToAnalysis} at the place depth of the
     * settings
     */
    private AliasOracleFactory aliasFactory;

    public DependenceGraphParams(ProgramRepository program, TypeOracle types, ProcedureId root) {
        this.program = program;
        this.types = types;
        this.root = root;
    }

    public ProgramRepository getProgram() {
        return program;
    }

    public TypeOracle getTypes() {
        return types;
    }

    public ProcedureId getRoot() {
        return root;
    }

    public List<Type> getRootInstantiation() {
        return rootInstantiation;
    }

    public DependenceGraphParams setRootInstantiation(List<Type> rootInstantiation) {
        this.rootInstantiation = new ArrayList<>(rootInstantiation);
        return this;
    }

    public CallChangeCallback getCallback() {
        return callback;
    }

    public DependenceGraphParams setCallback(CallChangeCallback callback) {
        this.callback = callback;
        return this;
    }

    public CallContextSelector getContextSelector() {
        return contextSelector;
    }

    public DependenceGraphParams setContextSelector(CallContextSelector contextSelector) {
        this.contextSelector = contextSelector;
        return this;
    }

    public InfoFlowSettings getSettings() {
        return settings;
    }

    public DependenceGraphParams setSettings(InfoFlowSettings settings) {
        this.settings = settings;
        return this;
    }

    public AliasOracleFactory getAliasFactory() {
        if (aliasFactory == null) {
            return new BorrowPointsToAnalysis.Factory(settings.getMaxPlaceDepth());
        }
        return aliasFactory;
    }

    public DependenceGraphParams setAliasFactory(AliasOracleFactory aliasFactory) {
        this.aliasFactory = aliasFactory;
        return this;
    }

    @Override
    public String toString() {
        return "root " + root + " callback " + callback.getClass().getSimpleName() + " contexts " + contextSelector
                + " " + settings;
    }
}
