package com.example.notebookengine.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable key/value state threaded through one run: caller inputs plus the
 * outputs of the cells executed so far. Owned by a single run, never shared.
 */
public class VariableContext {

    public static final String LAST_OUTPUT = "last_output";

    private final Map<String, Object> values = new LinkedHashMap<>();

    public static VariableContext of(Map<String, Object> inputs) {
        VariableContext context = new VariableContext();
        context.seed(inputs);
        return context;
    }

    public static String outputKey(int cellIndex) {
        return "cell_" + cellIndex + "_output";
    }

    /** Copy every entry of {@code inputs} into the context, overwriting existing keys. */
    public void seed(Map<String, Object> inputs) {
        if (inputs == null) {
            return;
        }
        inputs.forEach(this::set);
    }

    public void set(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("Variable key must not be null");
        }
        values.put(key, value);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Object getOrNull(String key) {
        return values.get(key);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * Record a completed cell's output under its index key. The last output only
     * moves when the cell produced something, so a note between two cells does not
     * break {@code {{prev}}} chaining.
     */
    public void recordOutput(int cellIndex, Object output) {
        set(outputKey(cellIndex), output);
        if (output != null) {
            set(LAST_OUTPUT, output);
        }
    }

    /** Immutable copy of the current entries, in insertion order. */
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public int size() {
        return values.size();
    }
}
