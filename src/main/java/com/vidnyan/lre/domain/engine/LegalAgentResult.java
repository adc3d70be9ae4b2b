package com.vidnyan.lre.domain.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.lre.domain.rule.ConfidenceLevel;

import java.util.List;

/**
 * Case-level legal assessment aggregated from all findings.
 */
public record LegalAgentResult(
    @JsonProperty("case_id") String caseId,
    @JsonProperty("legal_risks") List<LegalRisk> legalRisks,
    @JsonProperty("legal_conclusion") String legalConclusion,
    @JsonProperty("confidence_level") ConfidenceLevel confidenceLevel,
    @JsonProperty("missing_data") List<String> missingData,
    @JsonProperty("legal_basis") List<String> legalBasis
) {

    public LegalAgentResult {
        legalRisks = List.copyOf(legalRisks);
        missingData = List.copyOf(missingData);
        legalBasis = List.copyOf(legalBasis);
    }

    public boolean hasRisks() {
        return !legalRisks.isEmpty();
    }
}
