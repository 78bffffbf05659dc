package analysis.dataflow.interprocedural.pdg;

/**
 * Whether a skipped call reads or writes a place
 */
public enum FakeEffectKind {
    READ, WRITE;
}
