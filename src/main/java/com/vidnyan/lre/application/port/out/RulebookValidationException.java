package com.vidnyan.lre.application.port.out;

import java.util.List;

/**
 * A rulebook was readable but structurally invalid.
 * Carries every violated field path, e.g. {@code rules[2].trigger.condition}.
 */
public class RulebookValidationException extends RulebookLoadException {

    private final String sourceName;
    private final List<String> violations;

    public RulebookValidationException(String sourceName, List<String> violations) {
        super("Invalid rulebook " + sourceName + ": " + String.join("; ", violations));
        this.sourceName = sourceName;
        this.violations = List.copyOf(violations);
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<String> getViolations() {
        return violations;
    }
}
