package com.vidnyan.lre.domain.rule;

import java.util.List;

/**
 * Advisory description of the documents that support a rule. Never evaluated.
 */
public record EvidenceRequired(List<String> documentTypes, List<String> descriptions) {

    public EvidenceRequired {
        documentTypes = documentTypes == null ? List.of() : List.copyOf(documentTypes);
        descriptions = descriptions == null ? List.of() : List.copyOf(descriptions);
    }

    public static EvidenceRequired none() {
        return new EvidenceRequired(List.of(), List.of());
    }
}
