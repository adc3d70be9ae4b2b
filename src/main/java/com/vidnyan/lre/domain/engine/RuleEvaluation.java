package com.vidnyan.lre.domain.engine;

import com.vidnyan.lre.domain.result.RuleState;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcomes of one rulebook run, in rulebook order.
 */
public record RuleEvaluation(List<RuleOutcome> outcomes, boolean legalContextEmpty) {

    public RuleEvaluation {
        outcomes = List.copyOf(outcomes);
    }

    public List<LegalRisk> risks() {
        List<LegalRisk> risks = new ArrayList<>();
        for (RuleOutcome outcome : outcomes) {
            if (outcome instanceof RuleOutcome.Triggered triggered) {
                risks.add(triggered.risk());
            }
        }
        return risks;
    }

    /**
     * Discarded-citation notes, rendered missing-data templates and not-evaluable notes, in rule order.
     */
    public List<String> missingData() {
        List<String> notes = new ArrayList<>();
        for (RuleOutcome outcome : outcomes) {
            if (outcome instanceof RuleOutcome.Triggered triggered) {
                notes.addAll(triggered.missingData());
            } else if (outcome instanceof RuleOutcome.NotEvaluable notEvaluable) {
                notes.add("Datos insuficientes para evaluar la regla " + notEvaluable.ruleId()
                        + ": faltan " + String.join(", ", notEvaluable.missingVariables()));
            }
        }
        return notes;
    }

    public List<RuleOutcome> withState(RuleState state) {
        return outcomes.stream().filter(outcome -> outcome.state() == state).toList();
    }

    public long count(RuleState state) {
        return outcomes.stream().filter(outcome -> outcome.state() == state).count();
    }

    public boolean hasDiscardedCitations() {
        return outcomes.stream()
                .anyMatch(outcome -> outcome instanceof RuleOutcome.Triggered triggered
                        && !triggered.discardedCitations().isEmpty());
    }
}
