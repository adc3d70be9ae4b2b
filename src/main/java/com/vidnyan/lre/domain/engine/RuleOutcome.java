package com.vidnyan.lre.domain.engine;

import com.vidnyan.lre.domain.result.RuleState;
import com.vidnyan.lre.domain.rule.RuleDefinition;

import java.util.List;

/**
 * Tagged result of evaluating one rule. Failures are values, not exceptions,
 * so one bad rule never aborts the rest of the rulebook.
 */
public sealed interface RuleOutcome
        permits RuleOutcome.Triggered, RuleOutcome.Discarded, RuleOutcome.NotEvaluable, RuleOutcome.Errored {

    RuleDefinition rule();

    RuleState state();

    default String ruleId() {
        return rule().ruleId();
    }

    record Triggered(RuleDefinition rule, LegalRisk risk, List<String> discardedCitations,
                     List<String> missingData) implements RuleOutcome {
        public Triggered {
            discardedCitations = List.copyOf(discardedCitations);
            missingData = List.copyOf(missingData);
        }

        @Override
        public RuleState state() {
            return RuleState.TRIGGERED;
        }
    }

    /**
     * @param conditionResult false, or null when the condition could not be evaluated
     */
    record Discarded(RuleDefinition rule, Boolean conditionResult) implements RuleOutcome {
        @Override
        public RuleState state() {
            return RuleState.DISCARDED;
        }
    }

    record NotEvaluable(RuleDefinition rule, List<String> missingVariables) implements RuleOutcome {
        public NotEvaluable {
            missingVariables = List.copyOf(missingVariables);
        }

        @Override
        public RuleState state() {
            return RuleState.NOT_EVALUABLE;
        }
    }

    record Errored(RuleDefinition rule, String reason) implements RuleOutcome {
        @Override
        public RuleState state() {
            return RuleState.ERRORED;
        }
    }
}
