package com.vidnyan.lre.domain.rule;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * One rule of the rulebook: when it applies, how severe it is, how confident we are,
 * what it says and which articles it cites.
 * Immutable value object loaded from JSON.
 */
public record RuleDefinition(
    String ruleId,
    String riskType,
    List<String> articleRefs,
    Trigger trigger,
    EvidenceRequired evidenceRequired,
    EscalationLadder<SeverityLevel> severityLogic,
    EscalationLadder<ConfidenceLevel> confidenceLogic,
    RuleOutputs outputs
) {

    public RuleDefinition {
        articleRefs = articleRefs == null ? List.of() : List.copyOf(articleRefs);
        evidenceRequired = evidenceRequired == null ? EvidenceRequired.none() : evidenceRequired;
        severityLogic = severityLogic == null ? EscalationLadder.empty(SeverityLevel.class) : severityLogic;
        confidenceLogic = confidenceLogic == null ? EscalationLadder.empty(ConfidenceLevel.class) : confidenceLogic;
    }

    /**
     * Builder for RuleDefinition.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String ruleId;
        private String riskType;
        private List<String> articleRefs = List.of();
        private Trigger trigger;
        private EvidenceRequired evidenceRequired = EvidenceRequired.none();
        private EscalationLadder<SeverityLevel> severityLogic = EscalationLadder.empty(SeverityLevel.class);
        private EscalationLadder<ConfidenceLevel> confidenceLogic = EscalationLadder.empty(ConfidenceLevel.class);
        private RuleOutputs outputs;

        public Builder ruleId(String id) { this.ruleId = id; return this; }
        public Builder riskType(String type) { this.riskType = type; return this; }
        public Builder articleRefs(List<String> refs) { this.articleRefs = refs; return this; }
        public Builder trigger(Trigger trg) { this.trigger = trg; return this; }
        public Builder evidenceRequired(EvidenceRequired evidence) { this.evidenceRequired = evidence; return this; }
        public Builder severityLogic(EscalationLadder<SeverityLevel> ladder) { this.severityLogic = ladder; return this; }
        public Builder confidenceLogic(EscalationLadder<ConfidenceLevel> ladder) { this.confidenceLogic = ladder; return this; }
        public Builder outputs(RuleOutputs out) { this.outputs = out; return this; }

        public Builder trigger(String condition, String... variablesRequired) {
            this.trigger = new Trigger(condition, new LinkedHashSet<>(Arrays.asList(variablesRequired)));
            return this;
        }

        public Builder outputs(String descriptionTemplate, String recommendationTemplate) {
            this.outputs = new RuleOutputs(descriptionTemplate, recommendationTemplate, null);
            return this;
        }

        public RuleDefinition build() {
            return new RuleDefinition(ruleId, riskType, articleRefs, trigger, evidenceRequired,
                    severityLogic, confidenceLogic, outputs);
        }
    }
}
