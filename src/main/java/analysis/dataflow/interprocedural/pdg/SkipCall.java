package analysis.dataflow.interprocedural.pdg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decision of a {@link CallChangeCallback} for one call site
 */
public final class SkipCall {

    public enum Kind {
        /**
         * Analyze the call as usual
         */
        NO_SKIP,
        /**
         * Do not analyze the callee, use the supplied effects instead
         */
        SKIP_WITH_EFFECTS,
        /**
         * Do not analyze the callee, use the conservative treatment and mark
         * the callee as reached but not analyzed
         */
        SKIP_OPAQUE,
        /**
         * If the callee is a compiler generated async wrapper, analyze the
         * procedure it forwards to instead
         */
        UNWRAP;
    }

    private static final SkipCall NO_SKIP = new SkipCall(Kind.NO_SKIP, Collections.<FakeEffect> emptyList());
    private static final SkipCall SKIP_OPAQUE = new SkipCall(Kind.SKIP_OPAQUE, Collections.<FakeEffect> emptyList());
    private static final SkipCall UNWRAP = new SkipCall(Kind.UNWRAP, Collections.<FakeEffect> emptyList());

    private final Kind kind;
    private final List<FakeEffect> fakeEffects;

    private SkipCall(Kind kind, List<FakeEffect> fakeEffects) {
        this.kind = kind;
        this.fakeEffects = fakeEffects;
    }

    public static SkipCall noSkip() {
        return NO_SKIP;
    }

    public static SkipCall skipOpaque() {
        return SKIP_OPAQUE;
    }

    public static SkipCall unwrap() {
        return UNWRAP;
    }

    /**
     * @param effects
     *            what the skipped callee reads and writes
     * @return decision to skip the call with the given effects
     */
    public static SkipCall skipWithEffects(List<FakeEffect> effects) {
        return new SkipCall(Kind.SKIP_WITH_EFFECTS, Collections.unmodifiableList(new ArrayList<>(effects)));
    }

    public Kind getKind() {
        return kind;
    }

    public List<FakeEffect> getFakeEffects() {
        return fakeEffects;
    }

    @Override
    public String toString() {
        return kind == Kind.SKIP_WITH_EFFECTS ? kind + fakeEffects.toString() : kind.toString();
    }
}
