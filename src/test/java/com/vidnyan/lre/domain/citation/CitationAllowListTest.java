package com.vidnyan.lre.domain.citation;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CitationAllowListTest {

    private static final String CONTEXT = """
            Art. 5. Deber de solicitar la declaración de concurso.
            Artículo 165 de la Ley Concursal anterior.
            ART 443. Supuestos especiales. Véanse los artículos 6 y siguientes.
            """;

    @Test
    void extractAllowedArticles_ShouldRecognizeSurfaceForms() {
        Set<String> articles = CitationAllowList.extractAllowedArticles(CONTEXT);

        assertThat(articles).containsExactlyInAnyOrder("5", "165", "443", "6");
    }

    @Test
    void extractAllowedArticles_ShouldIgnoreCaseAndLeadingZeros() {
        assertThat(CitationAllowList.extractAllowedArticles("según el aRt. 007 y el ARTÍCULO 12"))
                .containsExactlyInAnyOrder("7", "12");
    }

    @Test
    void extractAllowedArticles_ShouldIgnoreNumbersThatAreNotArticles() {
        assertTrue(CitationAllowList.extractAllowedArticles("Departamento 12, plazo de 60 días").isEmpty());
        assertTrue(CitationAllowList.extractAllowedArticles("").isEmpty());
        assertTrue(CitationAllowList.extractAllowedArticles(null).isEmpty());
    }

    @Test
    void normalizeArticleReference_ShouldMapToArticleNumber() {
        assertEquals(Optional.of("165"), CitationAllowList.normalizeArticleReference("Art. 165 LC"));
        assertEquals(Optional.of("443"), CitationAllowList.normalizeArticleReference("artículo 443.1"));
        assertEquals(Optional.of("5"), CitationAllowList.normalizeArticleReference("05"));
        assertEquals(Optional.empty(), CitationAllowList.normalizeArticleReference("artículo sin número"));
        assertEquals(Optional.empty(), CitationAllowList.normalizeArticleReference(null));
    }

    @Test
    void filterLegalArticles_ShouldPartitionCitations() {
        CitationFilterResult result = CitationAllowList.filterLegalArticles(
                List.of("Art. 5", "Art. 99", "Artículo 443", "sin número"), Set.of("5", "443"), CONTEXT);

        assertEquals(List.of("Art. 5", "Artículo 443"), result.valid());
        assertEquals(List.of("Art. 99", "sin número"), result.discarded());
        assertTrue(result.hasDiscarded());
    }

    @Test
    void filter_ShouldKeepOriginalCitationText() {
        CitationAllowList allowList = CitationAllowList.fromLegalContext(CONTEXT);

        CitationFilterResult result = allowList.filter(List.of("ART. 0005", "Art. 6"));

        assertEquals(List.of("ART. 0005", "Art. 6"), result.valid());
        assertFalse(result.hasDiscarded());
        assertTrue(allowList.permits("artículo 165"));
        assertFalse(allowList.permits("Art. 166"));
        assertThat(allowList.articles()).containsExactly("165", "443", "5", "6");
    }

    @Test
    void emptyContext_ShouldDiscardEveryCitation() {
        CitationAllowList allowList = CitationAllowList.fromLegalContext("   ");

        CitationFilterResult result = allowList.filter(List.of("Art. 5"));

        assertTrue(allowList.isEmpty());
        assertTrue(result.valid().isEmpty());
        assertEquals(List.of("Art. 5"), result.discarded());
    }
}
