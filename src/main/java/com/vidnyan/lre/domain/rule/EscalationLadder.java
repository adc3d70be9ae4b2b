package com.vidnyan.lre.domain.rule;

import com.vidnyan.lre.domain.expression.ExpressionEvaluator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered mapping from level to an optional condition.
 * Levels are scanned in declaration order (highest first); the first condition that
 * evaluates to exactly {@code true} wins. If two conditions hold at once the higher level wins.
 */
public final class EscalationLadder<L extends Enum<L> & LadderLevel> {

    private final Class<L> levelType;
    private final Map<L, String> conditions;

    private EscalationLadder(Class<L> levelType, Map<L, String> conditions) {
        this.levelType = levelType;
        EnumMap<L, String> copy = new EnumMap<>(levelType);
        conditions.forEach((level, condition) -> {
            if (condition != null && !condition.isBlank()) {
                copy.put(level, condition);
            }
        });
        this.conditions = Collections.unmodifiableMap(copy);
    }

    public static <L extends Enum<L> & LadderLevel> EscalationLadder<L> of(Class<L> levelType, Map<L, String> conditions) {
        return new EscalationLadder<>(levelType, conditions);
    }

    public static <L extends Enum<L> & LadderLevel> EscalationLadder<L> empty(Class<L> levelType) {
        return new EscalationLadder<>(levelType, Map.of());
    }

    public L resolve(ExpressionEvaluator evaluator, L fallback) {
        for (L level : levelType.getEnumConstants()) {
            String condition = conditions.get(level);
            if (condition != null && Boolean.TRUE.equals(evaluator.evaluate(condition))) {
                return level;
            }
        }
        return fallback;
    }

    public Optional<String> conditionFor(L level) {
        return Optional.ofNullable(conditions.get(level));
    }

    public Map<L, String> conditions() {
        return conditions;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof EscalationLadder<?> that
                && levelType.equals(that.levelType)
                && conditions.equals(that.conditions);
    }

    @Override
    public int hashCode() {
        return conditions.hashCode();
    }

    @Override
    public String toString() {
        return "EscalationLadder" + conditions;
    }
}
