package analysis.dataflow.interprocedural.pdg;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Answer of a {@link CallChangeCallback}: how to treat the call, plus metadata
 * to attach to the call site in the dependence graph
 */
public final class CallChanges {

    private final SkipCall skip;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    public CallChanges(SkipCall skip) {
        this.skip = skip;
    }

    /**
     * @return changes that analyze the call normally
     */
    public static CallChanges proceed() {
        return new CallChanges(SkipCall.noSkip());
    }

    /**
     * @param key
     *            metadata key
     * @param value
     *            metadata value
     * @return this object
     */
    public CallChanges withMetadata(String key, String value) {
        metadata.put(key, value);
        return this;
    }

    public SkipCall getSkip() {
        return skip;
    }

    public Map<String, String> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    @Override
    public String toString() {
        return skip + (metadata.isEmpty() ? "" : " " + metadata);
    }
}
