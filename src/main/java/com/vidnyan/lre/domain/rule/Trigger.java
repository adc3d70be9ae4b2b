package com.vidnyan.lre.domain.rule;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Condition that decides whether a rule applies, plus the variables it needs.
 */
public record Trigger(String condition, Set<String> variablesRequired) {

    public Trigger {
        variablesRequired = variablesRequired == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(variablesRequired));
    }
}
