package com.vidnyan.lre.domain.rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Versioned, read-only collection of rules. Loaded once and passed explicitly to every evaluation.
 */
public record Rulebook(Map<String, Object> metadata, List<RuleDefinition> rules) {

    public Rulebook {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static Rulebook of(String version, List<RuleDefinition> rules) {
        return new Rulebook(Map.of("version", version), rules);
    }

    public Optional<String> version() {
        Object version = metadata.get("version");
        return version == null ? Optional.empty() : Optional.of(String.valueOf(version));
    }

    public int size() {
        return rules.size();
    }
}
