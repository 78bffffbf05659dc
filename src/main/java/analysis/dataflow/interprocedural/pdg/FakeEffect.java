package analysis.dataflow.interprocedural.pdg;

import analysis.ir.Place;

/**
 * Effect of a skipped call, stated on the callee's own places: local 0 is the
 * returned value and locals 1 to n are the parameters
 */
public final class FakeEffect {

    private final Place place;
    private final FakeEffectKind kind;

    public FakeEffect(Place place, FakeEffectKind kind) {
        this.place = place;
        this.kind = kind;
    }

    public static FakeEffect read(Place p) {
        return new FakeEffect(p, FakeEffectKind.READ);
    }

    public static FakeEffect write(Place p) {
        return new FakeEffect(p, FakeEffectKind.WRITE);
    }

    public Place getPlace() {
        return place;
    }

    public FakeEffectKind getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof FakeEffect)) {
            return false;
        }
        FakeEffect other = (FakeEffect) obj;
        return kind == other.kind && place.equals(other.place);
    }

    @Override
    public int hashCode() {
        return place.hashCode() * 31 + kind.hashCode();
    }

    @Override
    public String toString() {
        return kind + " " + place;
    }
}
