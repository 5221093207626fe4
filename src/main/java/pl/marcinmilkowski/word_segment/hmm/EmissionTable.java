package pl.marcinmilkowski.word_segment.hmm;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-state character emission log-probabilities, trained offline.
 *
 * Immutable once built. Character/state pairs without an entry score
 * {@link HmmModel#MIN_FLOAT}.
 *
 * JSON form, one object per state (states may be omitted):
 * <pre>
 * { "B": { "中": -5.12, ... }, "E": { ... }, "M": { ... }, "S": { ... } }
 * </pre>
 */
public final class EmissionTable {

    private static final Logger logger = LoggerFactory.getLogger(EmissionTable.class);

    private final Map<State, Map<Integer, Double>> emissions;

    private EmissionTable(Map<State, Map<Integer, Double>> emissions) {
        this.emissions = emissions;
    }

    /**
     * Log-probability of observing {@code codePoint} in {@code state}.
     */
    public double logProbability(State state, int codePoint) {
        Double value = emissions.get(state).get(codePoint);
        return value != null ? value : HmmModel.MIN_FLOAT;
    }

    /**
     * Number of characters with an entry for the given state.
     */
    public int size(State state) {
        return emissions.get(state).size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parse an emission table from JSON text.
     *
     * @throws IllegalArgumentException if the JSON is not an object of state objects
     */
    public static EmissionTable fromJson(String json) {
        JSONObject root = JSON.parseObject(json);
        if (root == null) {
            throw new IllegalArgumentException("Empty emission table");
        }
        Builder builder = builder();
        for (String key : root.keySet()) {
            State state;
            try {
                state = State.valueOf(key);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown state in emission table: " + key, e);
            }
            JSONObject entries = root.getJSONObject(key);
            if (entries == null) {
                throw new IllegalArgumentException("Emission entries for state " + key + " must be an object");
            }
            for (String character : entries.keySet()) {
                if (character.codePointCount(0, character.length()) != 1) {
                    throw new IllegalArgumentException(
                        "Emission key must be a single character: '" + character + "' (state " + key + ")");
                }
                builder.put(state, character.codePointAt(0), entries.getDoubleValue(character));
            }
        }
        return builder.build();
    }

    /**
     * Load an emission table from a UTF-8 JSON file.
     */
    public static EmissionTable load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Emission table not found: " + path);
        }
        EmissionTable table = fromJson(Files.readString(path, StandardCharsets.UTF_8));
        logger.info("Loaded emission table from {}: {}", path, table);
        return table;
    }

    /**
     * Load an emission table from a UTF-8 JSON stream. The stream is not closed.
     */
    public static EmissionTable load(InputStream in) throws IOException {
        return fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return String.format("EmissionTable[B=%d, E=%d, M=%d, S=%d]",
            size(State.B), size(State.E), size(State.M), size(State.S));
    }

    /**
     * Accumulates entries; later puts for the same pair win.
     */
    public static final class Builder {
        private final Map<State, Map<Integer, Double>> emissions = new EnumMap<>(State.class);

        private Builder() {
            for (State state : State.values()) {
                emissions.put(state, new HashMap<>());
            }
        }

        public Builder put(State state, int codePoint, double logProbability) {
            emissions.get(state).put(codePoint, logProbability);
            return this;
        }

        public Builder put(State state, String character, double logProbability) {
            return put(state, character.codePointAt(0), logProbability);
        }

        public EmissionTable build() {
            Map<State, Map<Integer, Double>> frozen = new EnumMap<>(State.class);
            for (Map.Entry<State, Map<Integer, Double>> e : emissions.entrySet()) {
                frozen.put(e.getKey(), Collections.unmodifiableMap(new HashMap<>(e.getValue())));
            }
            return new EmissionTable(Collections.unmodifiableMap(frozen));
        }
    }
}
