package com.vidnyan.lre.domain.expression;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Read-only snapshot of the facts of one case, keyed by variable name.
 * A key present with a null value is "known to be null"; an absent key is "insufficient data".
 */
public final class CaseVariables {

    private static final CaseVariables EMPTY = new CaseVariables(new TreeMap<>());

    private final SortedMap<String, Value> values;

    private CaseVariables(SortedMap<String, Value> values) {
        this.values = Collections.unmodifiableSortedMap(values);
    }

    public static CaseVariables empty() {
        return EMPTY;
    }

    /**
     * Builds a snapshot from raw values; the caller's map is copied, never retained.
     */
    public static CaseVariables of(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        SortedMap<String, Value> resolved = new TreeMap<>();
        raw.forEach((name, value) -> {
            if (name == null) {
                throw new IllegalArgumentException("Variable names must not be null");
            }
            resolved.put(name, Value.of(value));
        });
        return new CaseVariables(resolved);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * Missing identifiers resolve to null rather than failing.
     */
    public Value resolve(String name) {
        return values.getOrDefault(name, Value.NULL);
    }

    /**
     * Names from {@code required} that are absent from this snapshot, sorted.
     */
    public List<String> missing(Collection<String> required) {
        return required.stream()
                .filter(name -> !values.containsKey(name))
                .distinct()
                .sorted()
                .toList();
    }

    public Map<String, Value> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof CaseVariables that && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "CaseVariables" + values;
    }
}
