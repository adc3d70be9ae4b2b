package com.vidnyan.lre.adapter.out.ai;

import com.vidnyan.lre.application.port.out.RiskExplainer;
import com.vidnyan.lre.domain.engine.LegalAgentResult;
import com.vidnyan.lre.domain.engine.LegalRisk;
import com.vidnyan.lre.domain.result.RuleEngineResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Template-based explainer for development/testing.
 * Deterministic and model-free; can be replaced with a real LLM integration.
 * Only restates what the engine decided.
 */
@Slf4j
@Component
public class TemplateRiskExplainer implements RiskExplainer {

    static final String DISCLAIMER =
            "Explicación generada automáticamente a partir de reglas deterministas. "
            + "No sustituye el criterio de un profesional.";

    private static final int MAX_NOTES = 5;

    @Override
    public Explanation explain(LegalAgentResult legalResult, RuleEngineResult engineResult) {
        log.info("Explaining {} findings of case {}...", legalResult.legalRisks().size(), legalResult.caseId());

        if (!legalResult.hasRisks()) {
            return new Explanation(legalResult.legalConclusion(), List.of(), DISCLAIMER);
        }

        List<Note> notes = legalResult.legalRisks().stream()
                .limit(MAX_NOTES)
                .map(this::createNote)
                .toList();

        String summary = String.format(
                "%s Confianza global: %s. %d regla(s) evaluada(s), %d descartada(s).",
                legalResult.legalConclusion(),
                legalResult.confidenceLevel().label(),
                engineResult.evaluatedRules().size(),
                engineResult.discardedRules().size());

        return new Explanation(summary, notes, DISCLAIMER);
    }

    private Note createNote(LegalRisk risk) {
        String articles = risk.legalArticles().isEmpty()
                ? "sin artículos verificados en el contexto legal"
                : "fundamento: " + String.join(", ", risk.legalArticles());

        String text = String.format("%s (severidad %s, confianza %s; %s). %s",
                risk.description(),
                risk.severity().label(),
                risk.confidence().label(),
                articles,
                risk.recommendation());

        return new Note(risk.ruleId(), risk.riskType(), text);
    }
}
