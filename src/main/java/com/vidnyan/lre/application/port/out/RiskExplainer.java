package com.vidnyan.lre.application.port.out;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.lre.domain.engine.LegalAgentResult;
import com.vidnyan.lre.domain.result.RuleEngineResult;

import java.util.List;

/**
 * Port for natural-language explanation of findings.
 * Implemented by language-model adapters. Receives the finished results read-only:
 * an explainer may rephrase findings but never alter severity, confidence,
 * cited articles or the set of rules.
 */
public interface RiskExplainer {

    /**
     * Explain the findings of one evaluated case.
     */
    Explanation explain(LegalAgentResult legalResult, RuleEngineResult engineResult);

    /**
     * Explanation of a case.
     */
    record Explanation(
        @JsonProperty("summary") String summary,
        @JsonProperty("notes") List<Note> notes,
        @JsonProperty("disclaimer") String disclaimer
    ) {
        public Explanation {
            notes = List.copyOf(notes);
        }
    }

    /**
     * Explanation of a single finding.
     */
    record Note(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("risk_type") String riskType,
        @JsonProperty("text") String text
    ) {}
}
