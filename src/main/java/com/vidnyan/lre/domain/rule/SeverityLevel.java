package com.vidnyan.lre.domain.rule;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Severity of a finding, highest first. Declaration order is the ladder scan order.
 */
public enum SeverityLevel implements LadderLevel {
    CRITICAL("critical", "critica"),
    HIGH("high", "alta"),
    MEDIUM("medium", "media"),
    LOW("low", "baja"),
    INDETERMINATE("indeterminate", "indeterminado");

    private final String key;
    private final String label;

    SeverityLevel(String key, String label) {
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

    /**
     * Critical, high and medium findings escalate the overall confidence to "media".
     */
    public boolean escalates() {
        return this == CRITICAL || this == HIGH || this == MEDIUM;
    }

    /**
     * Levels a rulebook may put a condition on; indeterminate is the fallback only.
     */
    public static Optional<SeverityLevel> fromRulebookKey(String key) {
        for (SeverityLevel level : values()) {
            if (level != INDETERMINATE && level.key.equals(key)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
