package com.vidnyan.lre.domain.rule;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Confidence in a finding or in an overall result, highest first.
 */
public enum ConfidenceLevel implements LadderLevel {
    HIGH("high", "alta"),
    MEDIUM("medium", "media"),
    LOW("low", "baja"),
    INDETERMINATE("indeterminate", "indeterminado");

    private final String key;
    private final String label;

    ConfidenceLevel(String key, String label) {
        this.key = key;
        this.label = label;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public boolean isIndeterminate() {
        return this == INDETERMINATE;
    }

    public static Optional<ConfidenceLevel> fromRulebookKey(String key) {
        for (ConfidenceLevel level : values()) {
            if (level.key.equals(key)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
