package com.vidnyan.lre.domain.engine;

import com.vidnyan.lre.domain.citation.CitationAllowList;
import com.vidnyan.lre.domain.citation.CitationFilterResult;
import com.vidnyan.lre.domain.expression.CaseVariables;
import com.vidnyan.lre.domain.expression.ExpressionEvaluator;
import com.vidnyan.lre.domain.result.RuleDecision;
import com.vidnyan.lre.domain.result.RuleEngineResult;
import com.vidnyan.lre.domain.result.RuleState;
import com.vidnyan.lre.domain.rule.ConfidenceLevel;
import com.vidnyan.lre.domain.rule.RuleDefinition;
import com.vidnyan.lre.domain.rule.Rulebook;
import com.vidnyan.lre.domain.rule.SeverityLevel;
import com.vidnyan.lre.domain.rule.TemplateRenderer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Rule Engine - turns case facts into legal risk findings without any model call.
 * <p>
 * Stateless: the rulebook, the variable snapshot and the legal context are passed into
 * every call, so independent cases can be evaluated concurrently on one instance.
 */
@Slf4j
public class RuleEngine {

    public static final String FLAG_HAS_TRIGGERED_RULES = "has_triggered_rules";
    public static final String FLAG_HAS_CRITICAL_RISK = "has_critical_risk";
    public static final String FLAG_HAS_HIGH_RISK = "has_high_risk";
    public static final String FLAG_HAS_DISCARDED_CITATIONS = "has_discarded_citations";
    public static final String FLAG_HAS_NOT_EVALUABLE_RULES = "has_not_evaluable_rules";
    public static final String FLAG_HAS_ERRORED_RULES = "has_errored_rules";
    public static final String FLAG_LEGAL_CONTEXT_EMPTY = "legal_context_empty";

    static final String NO_RISKS_CONCLUSION =
            "No se detectaron riesgos legales específicos según las reglas evaluadas.";

    private static final int DEFAULT_MAX_CONCLUSION_ARTICLES = 5;

    private final Clock clock;
    private final int maxConclusionArticles;

    public RuleEngine() {
        this(Clock.systemUTC(), DEFAULT_MAX_CONCLUSION_ARTICLES);
    }

    public RuleEngine(Clock clock, int maxConclusionArticles) {
        if (maxConclusionArticles < 1) {
            throw new IllegalArgumentException("maxConclusionArticles must be positive");
        }
        this.clock = clock;
        this.maxConclusionArticles = maxConclusionArticles;
    }

    /**
     * Evaluate every rule of the rulebook against one case.
     */
    public RuleEvaluation evaluate(Rulebook rulebook, CaseVariables variables, String legalContext) {
        CitationAllowList allowList = CitationAllowList.fromLegalContext(legalContext);
        ExpressionEvaluator evaluator = new ExpressionEvaluator(variables);

        List<RuleOutcome> outcomes = new ArrayList<>(rulebook.size());
        for (RuleDefinition rule : rulebook.rules()) {
            outcomes.add(evaluateRule(rule, evaluator, variables, allowList));
        }

        RuleEvaluation evaluation = new RuleEvaluation(outcomes, allowList.isEmpty());
        log.info("Evaluated rulebook {}: {} triggered, {} discarded, {} not evaluable, {} errored",
                rulebook.version().orElse("unversioned"),
                evaluation.count(RuleState.TRIGGERED),
                evaluation.count(RuleState.DISCARDED),
                evaluation.count(RuleState.NOT_EVALUABLE),
                evaluation.count(RuleState.ERRORED));
        return evaluation;
    }

    /**
     * Findings of every triggered rule, in rulebook order.
     */
    public List<LegalRisk> evaluateRules(Rulebook rulebook, CaseVariables variables, String legalContext) {
        return evaluate(rulebook, variables, legalContext).risks();
    }

    RuleOutcome evaluateRule(RuleDefinition rule, ExpressionEvaluator evaluator,
                             CaseVariables variables, CitationAllowList allowList) {
        try {
            List<String> missing = variables.missing(rule.trigger().variablesRequired());
            if (!missing.isEmpty()) {
                log.debug("Rule {} not evaluable, missing variables {}", rule.ruleId(), missing);
                return new RuleOutcome.NotEvaluable(rule, missing);
            }

            Boolean triggered = evaluator.evaluate(rule.trigger().condition());
            if (!Boolean.TRUE.equals(triggered)) {
                log.debug("Rule {} discarded, condition evaluated to {}", rule.ruleId(), triggered);
                return new RuleOutcome.Discarded(rule, triggered);
            }

            SeverityLevel severity = rule.severityLogic().resolve(evaluator, SeverityLevel.INDETERMINATE);
            ConfidenceLevel confidence = rule.confidenceLogic().resolve(evaluator, ConfidenceLevel.INDETERMINATE);

            CitationFilterResult citations = allowList.filter(rule.articleRefs());
            if (citations.hasDiscarded()) {
                // an unverifiable citation caps confidence regardless of the ladder
                confidence = ConfidenceLevel.INDETERMINATE;
            }

            EvidenceStatus evidenceStatus = EvidenceStatus.assess(rule.articleRefs(), citations, confidence);

            LegalRisk risk = new LegalRisk(
                    rule.ruleId(),
                    rule.riskType(),
                    TemplateRenderer.render(rule.outputs().descriptionTemplate(), variables),
                    severity,
                    confidence,
                    citations.valid(),
                    List.of(),
                    evidenceStatus,
                    TemplateRenderer.render(rule.outputs().recommendationTemplate(), variables));

            log.debug("Rule {} triggered: severity={}, confidence={}, evidence={}",
                    rule.ruleId(), severity.label(), confidence.label(), evidenceStatus.label());
            return new RuleOutcome.Triggered(rule, risk, citations.discarded(),
                    missingDataNotes(rule, citations, evidenceStatus, variables));
        } catch (RuntimeException e) {
            log.warn("Rule {} errored and was skipped: {}", rule.ruleId(), e.toString());
            return new RuleOutcome.Errored(rule, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private static List<String> missingDataNotes(RuleDefinition rule, CitationFilterResult citations,
                                                 EvidenceStatus evidenceStatus, CaseVariables variables) {
        List<String> notes = new ArrayList<>();
        for (String citation : citations.discarded()) {
            notes.add("El artículo '" + citation + "' citado por la regla " + rule.ruleId()
                    + " no figura en el contexto legal recuperado");
        }
        if (evidenceStatus != EvidenceStatus.SUFFICIENT) {
            rule.outputs().missingData()
                    .map(template -> TemplateRenderer.render(template, variables))
                    .ifPresent(notes::add);
        }
        return notes;
    }

    /**
     * Aggregate findings into the case-level legal assessment.
     */
    public LegalAgentResult buildResult(String caseId, RuleEvaluation evaluation) {
        return buildResult(caseId, evaluation.risks(), evaluation.missingData());
    }

    public LegalAgentResult buildResult(String caseId, List<LegalRisk> risks) {
        return buildResult(caseId, risks, List.of());
    }

    public LegalAgentResult buildResult(String caseId, List<LegalRisk> risks, List<String> missingData) {
        if (risks.isEmpty()) {
            // absence of risk is a confident outcome, not a failure
            return new LegalAgentResult(caseId, List.of(), NO_RISKS_CONCLUSION,
                    ConfidenceLevel.HIGH, missingData, List.of());
        }

        Set<String> basis = new LinkedHashSet<>();
        for (LegalRisk risk : risks) {
            basis.addAll(risk.legalArticles());
        }

        StringBuilder conclusion = new StringBuilder()
                .append("Se detectaron ").append(risks.size()).append(" riesgo(s) legal(es).");
        if (!basis.isEmpty()) {
            conclusion.append(" Artículos relevantes: ")
                    .append(String.join(", ", basis.stream().limit(maxConclusionArticles).toList()));
        }

        return new LegalAgentResult(caseId, risks, conclusion.toString(),
                overallConfidence(risks), missingData, List.copyOf(basis));
    }

    /**
     * Weakest link: any indeterminate finding makes the whole result indeterminate;
     * otherwise critical/high/medium findings give "media" and low-only findings "baja".
     */
    static ConfidenceLevel overallConfidence(List<LegalRisk> risks) {
        if (risks.stream().anyMatch(LegalRisk::isIndeterminate)) {
            return ConfidenceLevel.INDETERMINATE;
        }
        boolean escalated = risks.stream().anyMatch(risk -> risk.severity().escalates());
        return escalated ? ConfidenceLevel.MEDIUM : ConfidenceLevel.LOW;
    }

    /**
     * Deterministic engine result: one decision per evaluated rule plus summary flags.
     * Not-evaluable rules are left out of the evaluated set.
     */
    public RuleEngineResult buildEngineResult(String caseId, Rulebook rulebook, RuleEvaluation evaluation) {
        RuleEngineResult.Builder builder = RuleEngineResult.builder(caseId, rulebook.version().orElse(null), clock);
        for (RuleOutcome outcome : evaluation.outcomes()) {
            if (outcome.state().isEvaluated()) {
                builder.addRuleDecision(toDecision(outcome));
            }
        }

        List<LegalRisk> risks = evaluation.risks();
        return builder
                .addFlag(FLAG_HAS_TRIGGERED_RULES, !risks.isEmpty())
                .addFlag(FLAG_HAS_CRITICAL_RISK, risks.stream().anyMatch(r -> r.severity() == SeverityLevel.CRITICAL))
                .addFlag(FLAG_HAS_HIGH_RISK, risks.stream().anyMatch(r -> r.severity() == SeverityLevel.HIGH))
                .addFlag(FLAG_HAS_DISCARDED_CITATIONS, evaluation.hasDiscardedCitations())
                .addFlag(FLAG_HAS_NOT_EVALUABLE_RULES, evaluation.count(RuleState.NOT_EVALUABLE) > 0)
                .addFlag(FLAG_HAS_ERRORED_RULES, evaluation.count(RuleState.ERRORED) > 0)
                .addFlag(FLAG_LEGAL_CONTEXT_EMPTY, evaluation.legalContextEmpty())
                .build();
    }

    static RuleDecision toDecision(RuleOutcome outcome) {
        RuleDefinition rule = outcome.rule();
        List<String> documentTypes = rule.evidenceRequired().documentTypes();

        if (outcome instanceof RuleOutcome.Triggered triggered) {
            LegalRisk risk = triggered.risk();
            return new RuleDecision(rule.ruleId(), rule.riskType(), rule.articleRefs(), true, RuleState.TRIGGERED,
                    risk.severity(), risk.confidence(), documentTypes, risk.legalArticles(),
                    "Condición cumplida: " + rule.trigger().condition()
                            + ". Evidencia " + risk.evidenceStatus().label() + ".",
                    score(risk.evidenceStatus()));
        }
        if (outcome instanceof RuleOutcome.Discarded discarded) {
            String rationale = discarded.conditionResult() == null
                    ? "Condición no evaluable: " + rule.trigger().condition()
                    : "Condición no cumplida: " + rule.trigger().condition();
            return new RuleDecision(rule.ruleId(), rule.riskType(), rule.articleRefs(), false, RuleState.DISCARDED,
                    SeverityLevel.INDETERMINATE, ConfidenceLevel.INDETERMINATE, documentTypes, List.of(),
                    rationale, 0.0);
        }
        if (outcome instanceof RuleOutcome.Errored errored) {
            return new RuleDecision(rule.ruleId(), rule.riskType(), rule.articleRefs(), false, RuleState.ERRORED,
                    SeverityLevel.INDETERMINATE, ConfidenceLevel.INDETERMINATE, documentTypes, List.of(),
                    "Error al evaluar la regla: " + errored.reason(), 0.0);
        }
        throw new IllegalArgumentException("No decision for a rule that was not evaluated: " + rule.ruleId());
    }

    private static double score(EvidenceStatus evidenceStatus) {
        return switch (evidenceStatus) {
            case SUFFICIENT -> 1.0;
            case INSUFFICIENT -> 0.5;
            case MISSING -> 0.25;
        };
    }
}
