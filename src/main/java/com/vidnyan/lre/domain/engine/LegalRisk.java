package com.vidnyan.lre.domain.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.lre.domain.rule.ConfidenceLevel;
import com.vidnyan.lre.domain.rule.SeverityLevel;

import java.util.List;

/**
 * A legal risk finding produced by a triggered rule. Only the rule engine creates these.
 * {@code legalArticles} holds citations that survived the allow-list, in rule order.
 */
public record LegalRisk(
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("risk_type") String riskType,
    @JsonProperty("description") String description,
    @JsonProperty("severity") SeverityLevel severity,
    @JsonProperty("confidence") ConfidenceLevel confidence,
    @JsonProperty("legal_articles") List<String> legalArticles,
    @JsonProperty("jurisprudence") List<String> jurisprudence,
    @JsonProperty("evidence_status") EvidenceStatus evidenceStatus,
    @JsonProperty("recommendation") String recommendation
) {

    public LegalRisk {
        legalArticles = legalArticles == null ? List.of() : List.copyOf(legalArticles);
        jurisprudence = jurisprudence == null ? List.of() : List.copyOf(jurisprudence);
    }

    /**
     * A finding whose severity or confidence could not be established.
     */
    @JsonIgnore
    public boolean isIndeterminate() {
        return severity.isIndeterminate() || confidence.isIndeterminate();
    }
}
