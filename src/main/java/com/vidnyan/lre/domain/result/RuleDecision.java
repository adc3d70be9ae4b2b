package com.vidnyan.lre.domain.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.lre.domain.rule.ConfidenceLevel;
import com.vidnyan.lre.domain.rule.SeverityLevel;

import java.util.List;

/**
 * Deterministic decision of one evaluated rule.
 * Carries everything needed to understand the decision without a language model.
 */
public record RuleDecision(
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("rule_name") String ruleName,
    @JsonProperty("articles") List<String> articles,
    @JsonProperty("applies") boolean applies,
    @JsonProperty("state") RuleState state,
    @JsonProperty("severity") SeverityLevel severity,
    @JsonProperty("confidence") ConfidenceLevel confidence,
    @JsonProperty("evidence_required") List<String> evidenceRequired,
    @JsonProperty("evidence_found") List<String> evidenceFound,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("score") double score
) {

    public RuleDecision {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("rule_id is required");
        }
        if (state == null || !state.isEvaluated()) {
            throw new IllegalArgumentException("Decision state must be an evaluated state, got " + state);
        }
        if (applies != (state == RuleState.TRIGGERED)) {
            throw new IllegalArgumentException("applies must be true exactly when the rule triggered: " + ruleId);
        }
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be within [0, 1]: " + score);
        }
        articles = articles == null ? List.of() : List.copyOf(articles);
        evidenceRequired = evidenceRequired == null ? List.of() : List.copyOf(evidenceRequired);
        evidenceFound = evidenceFound == null ? List.of() : List.copyOf(evidenceFound);
    }
}
