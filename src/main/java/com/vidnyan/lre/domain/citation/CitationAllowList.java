package com.vidnyan.lre.domain.citation;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Set of article numbers that physically appear in the legal text retrieved for a query.
 * <p>
 * Anything that wants to cite an article, a rule's static references or free text produced
 * downstream, must pass through {@link #filter(List)}. Articles are compared by normalized
 * number: "Art. 165 LC", "Artículo 165" and "ART 165" are all "165".
 */
@Slf4j
public final class CitationAllowList {

    private static final Pattern ARTICLE = Pattern.compile(
            "\\bart(?:[íi]culos?|s?\\.?)\\s*(\\d+)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern BARE_NUMBER = Pattern.compile("(\\d+)");

    private static final CitationAllowList EMPTY = new CitationAllowList(new TreeSet<>(), 0);

    private final SortedSet<String> allowed;
    private final int contextLength;

    private CitationAllowList(SortedSet<String> allowed, int contextLength) {
        this.allowed = Collections.unmodifiableSortedSet(allowed);
        this.contextLength = contextLength;
    }

    public static CitationAllowList fromLegalContext(String legalContext) {
        if (legalContext == null || legalContext.isBlank()) {
            return EMPTY;
        }
        return new CitationAllowList(extractAllowedArticles(legalContext), legalContext.length());
    }

    /**
     * Normalized article numbers referenced anywhere in the text, sorted.
     */
    public static SortedSet<String> extractAllowedArticles(String legalContext) {
        SortedSet<String> articles = new TreeSet<>();
        if (legalContext == null || legalContext.isEmpty()) {
            return articles;
        }
        Matcher matcher = ARTICLE.matcher(legalContext);
        while (matcher.find()) {
            articles.add(canonicalNumber(matcher.group(1)));
        }
        return articles;
    }

    /**
     * Maps a citation to the allow-list identifier space.
     *
     * @return the article number, or empty when the text holds no number
     */
    public static Optional<String> normalizeArticleReference(String citation) {
        if (citation == null || citation.isBlank()) {
            return Optional.empty();
        }
        Matcher article = ARTICLE.matcher(citation);
        if (article.find()) {
            return Optional.of(canonicalNumber(article.group(1)));
        }
        Matcher number = BARE_NUMBER.matcher(citation);
        if (number.find()) {
            return Optional.of(canonicalNumber(number.group(1)));
        }
        return Optional.empty();
    }

    /**
     * Partitions citations by whether their normalized number is allowed.
     * Every discarded citation is logged; the caller also receives it in the result.
     */
    public static CitationFilterResult filterLegalArticles(List<String> citations, Set<String> allowed, String legalContext) {
        return partition(citations, allowed, legalContext == null ? 0 : legalContext.length());
    }

    public CitationFilterResult filter(List<String> citations) {
        return partition(citations, allowed, contextLength);
    }

    public boolean permits(String citation) {
        return normalizeArticleReference(citation).map(allowed::contains).orElse(false);
    }

    public Set<String> articles() {
        return allowed;
    }

    public boolean isEmpty() {
        return allowed.isEmpty();
    }

    private static CitationFilterResult partition(List<String> citations, Set<String> allowed, int contextLength) {
        List<String> valid = new ArrayList<>();
        List<String> discarded = new ArrayList<>();
        for (String citation : citations) {
            Optional<String> normalized = normalizeArticleReference(citation);
            if (normalized.isPresent() && allowed.contains(normalized.get())) {
                valid.add(citation);
            } else {
                discarded.add(citation);
                log.warn("Discarded citation '{}': not present in retrieved legal context ({} chars)",
                        citation, contextLength);
            }
        }
        return new CitationFilterResult(valid, discarded);
    }

    private static String canonicalNumber(String digits) {
        return new BigInteger(digits).toString();
    }
}
