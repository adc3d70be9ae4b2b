package com.vidnyan.lre.domain.citation;

import java.util.List;

/**
 * Partition of a citation list into citations backed by the legal context and citations that are not.
 * Both lists keep the caller's order and original spelling.
 */
public record CitationFilterResult(List<String> valid, List<String> discarded) {

    public CitationFilterResult {
        valid = List.copyOf(valid);
        discarded = List.copyOf(discarded);
    }

    public boolean hasDiscarded() {
        return !discarded.isEmpty();
    }
}
