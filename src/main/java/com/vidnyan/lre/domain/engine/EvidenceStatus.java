package com.vidnyan.lre.domain.engine;

import com.fasterxml.jackson.annotation.JsonValue;
import com.vidnyan.lre.domain.citation.CitationFilterResult;
import com.vidnyan.lre.domain.rule.ConfidenceLevel;

import java.util.List;

/**
 * How well a finding is backed by the retrieved legal text.
 */
public enum EvidenceStatus {
    SUFFICIENT("suficiente"),
    INSUFFICIENT("insuficiente"),
    MISSING("falta");

    private final String label;

    EvidenceStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * MISSING when the rule cites articles and none survived filtering; INSUFFICIENT when some
     * were discarded or confidence is indeterminate; SUFFICIENT otherwise.
     */
    public static EvidenceStatus assess(List<String> declaredArticles, CitationFilterResult citations,
                                        ConfidenceLevel confidence) {
        if (!declaredArticles.isEmpty() && citations.valid().isEmpty()) {
            return MISSING;
        }
        if (citations.hasDiscarded() || confidence.isIndeterminate()) {
            return INSUFFICIENT;
        }
        return SUFFICIENT;
    }
}
