package com.vidnyan.lre.domain.engine;

import com.vidnyan.lre.domain.expression.CaseVariables;
import com.vidnyan.lre.domain.result.RuleDecision;
import com.vidnyan.lre.domain.result.RuleEngineResult;
import com.vidnyan.lre.domain.result.RuleState;
import com.vidnyan.lre.domain.rule.ConfidenceLevel;
import com.vidnyan.lre.domain.rule.EscalationLadder;
import com.vidnyan.lre.domain.rule.RuleDefinition;
import com.vidnyan.lre.domain.rule.RuleOutputs;
import com.vidnyan.lre.domain.rule.Rulebook;
import com.vidnyan.lre.domain.rule.SeverityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RuleEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    private final RuleEngine engine = new RuleEngine(CLOCK, 5);

    private static RuleDefinition insolvencyRule(List<String> articleRefs) {
        return RuleDefinition.builder()
                .ruleId("R-INSOLVENCIA")
                .riskType("retraso_solicitud_concurso")
                .articleRefs(articleRefs)
                .trigger("insolvencia_actual == true", "insolvencia_actual")
                .severityLogic(EscalationLadder.of(SeverityLevel.class, Map.of(SeverityLevel.HIGH, "true")))
                .confidenceLogic(EscalationLadder.of(ConfidenceLevel.class, Map.of(ConfidenceLevel.HIGH, "true")))
                .outputs(new RuleOutputs(
                        "Insolvencia actual: {insolvencia_actual}",
                        "Solicitar el concurso",
                        "Documentar la fecha de insolvencia"))
                .build();
    }

    private static RuleDefinition rule(String id, String condition, SeverityLevel severity, ConfidenceLevel confidence,
                                       String... variables) {
        return RuleDefinition.builder()
                .ruleId(id)
                .riskType("riesgo_" + id)
                .articleRefs(List.of("Art. 443"))
                .trigger(condition, variables)
                .severityLogic(EscalationLadder.of(SeverityLevel.class, Map.of(severity, "true")))
                .confidenceLogic(EscalationLadder.of(ConfidenceLevel.class, Map.of(confidence, "true")))
                .outputs("Descripción " + id, "Recomendación " + id)
                .build();
    }

    private static Rulebook rulebook(RuleDefinition... rules) {
        return Rulebook.of("test-1", List.of(rules));
    }

    private static CaseVariables insolvent() {
        return CaseVariables.of(Map.of("insolvencia_actual", true));
    }

    @Nested
    @DisplayName("citation outcomes")
    class CitationOutcomes {

        @Test
        void citedArticlePresentInContext_ShouldKeepConfidence() {
            RuleEvaluation evaluation = engine.evaluate(
                    rulebook(insolvencyRule(List.of("Art. 5"))), insolvent(), "Art. 5. Deber de solicitar el concurso.");

            List<LegalRisk> risks = evaluation.risks();
            assertEquals(1, risks.size());
            LegalRisk risk = risks.get(0);
            assertEquals(EvidenceStatus.SUFFICIENT, risk.evidenceStatus());
            assertEquals(ConfidenceLevel.HIGH, risk.confidence());
            assertEquals(SeverityLevel.HIGH, risk.severity());
            assertEquals(List.of("Art. 5"), risk.legalArticles());
            assertEquals("Insolvencia actual: true", risk.description());
            assertTrue(evaluation.missingData().isEmpty());
        }

        @Test
        void contextWithoutArticles_ShouldTriggerWithMissingEvidence() {
            RuleEvaluation evaluation = engine.evaluate(
                    rulebook(insolvencyRule(List.of("Art. 5"))), insolvent(), "Texto legal sin referencias.");

            LegalRisk risk = evaluation.risks().get(0);
            assertEquals(List.of(), risk.legalArticles());
            assertEquals(EvidenceStatus.MISSING, risk.evidenceStatus());
            assertEquals(ConfidenceLevel.INDETERMINATE, risk.confidence());
        }

        @Test
        void missingVariable_ShouldExcludeRuleFromEvaluatedSet() {
            Rulebook rulebook = rulebook(
                    insolvencyRule(List.of("Art. 5")),
                    rule("R-OTRA", "doble_contabilidad == true", SeverityLevel.HIGH, ConfidenceLevel.HIGH,
                            "doble_contabilidad"));

            RuleEvaluation evaluation = engine.evaluate(rulebook, insolvent(), "Art. 5");
            RuleEngineResult result = engine.buildEngineResult("case-c", rulebook, evaluation);

            RuleOutcome.NotEvaluable skipped = (RuleOutcome.NotEvaluable) evaluation.outcomes().get(1);
            assertEquals(List.of("doble_contabilidad"), skipped.missingVariables());
            assertEquals(1, result.evaluatedRules().size());
            assertTrue(result.triggeredRules().stream().noneMatch(d -> d.ruleId().equals("R-OTRA")));
            assertTrue(result.discardedRules().stream().noneMatch(d -> d.ruleId().equals("R-OTRA")));
            assertTrue(result.flag(RuleEngine.FLAG_HAS_NOT_EVALUABLE_RULES));
            assertThat(evaluation.missingData())
                    .containsExactly("Datos insuficientes para evaluar la regla R-OTRA: faltan doble_contabilidad");
        }

        @Test
        void highAndLowSeverity_ShouldEscalateOverallConfidenceToMedium() {
            Rulebook rulebook = rulebook(
                    rule("R-ALTA", "true", SeverityLevel.HIGH, ConfidenceLevel.HIGH),
                    rule("R-BAJA", "true", SeverityLevel.LOW, ConfidenceLevel.HIGH));

            LegalAgentResult result = engine.buildResult("case-e",
                    engine.evaluate(rulebook, CaseVariables.empty(), "Art. 443"));

            assertEquals(2, result.legalRisks().size());
            assertEquals(ConfidenceLevel.MEDIUM, result.confidenceLevel());
        }

        @Test
        void anyIndeterminateRisk_ShouldMakeOverallIndeterminate() {
            Rulebook rulebook = rulebook(
                    rule("R-ALTA", "true", SeverityLevel.HIGH, ConfidenceLevel.HIGH),
                    rule("R-DUDA", "true", SeverityLevel.LOW, ConfidenceLevel.INDETERMINATE));

            LegalAgentResult result = engine.buildResult("case-e",
                    engine.evaluate(rulebook, CaseVariables.empty(), "Art. 443"));

            assertEquals(ConfidenceLevel.INDETERMINATE, result.confidenceLevel());
        }

        @Test
        void evaluateRules_ShouldReturnTriggeredFindingsInRulebookOrder() {
            Rulebook rulebook = rulebook(
                    rule("R-B", "x > 1", SeverityLevel.LOW, ConfidenceLevel.LOW, "x"),
                    rule("R-NO", "x > 100", SeverityLevel.HIGH, ConfidenceLevel.HIGH, "x"),
                    rule("R-A", "x > 2", SeverityLevel.HIGH, ConfidenceLevel.HIGH, "x"));

            List<LegalRisk> risks = engine.evaluateRules(rulebook, CaseVariables.of(Map.of("x", 5)), "Art. 443");

            assertEquals(List.of("R-B", "R-A"), risks.stream().map(LegalRisk::ruleId).toList());
            assertEquals(List.of("Art. 443"), risks.get(1).legalArticles());
        }
    }

    @Nested
    @DisplayName("citation control")
    class CitationControl {

        @Test
        void discardedCitation_ShouldForceIndeterminateConfidence() {
            RuleEvaluation evaluation = engine.evaluate(
                    rulebook(insolvencyRule(List.of("Art. 5", "Art. 6"))), insolvent(), "Art. 5");

            LegalRisk risk = evaluation.risks().get(0);
            assertEquals(List.of("Art. 5"), risk.legalArticles());
            assertEquals(ConfidenceLevel.INDETERMINATE, risk.confidence());
            assertEquals(EvidenceStatus.INSUFFICIENT, risk.evidenceStatus());
            assertTrue(evaluation.hasDiscardedCitations());
            assertThat(evaluation.missingData()).containsExactly(
                    "El artículo 'Art. 6' citado por la regla R-INSOLVENCIA no figura en el contexto legal recuperado",
                    "Documentar la fecha de insolvencia");
        }

        @Test
        void removingArticleFromContext_NeverRaisesConfidence() {
            Rulebook rulebook = rulebook(insolvencyRule(List.of("Art. 5", "Art. 6")));

            ConfidenceLevel before = engine.evaluate(rulebook, insolvent(), "Art. 5 y Art. 6").risks().get(0).confidence();
            ConfidenceLevel after = engine.evaluate(rulebook, insolvent(), "Art. 5").risks().get(0).confidence();

            assertEquals(ConfidenceLevel.HIGH, before);
            assertTrue(after.ordinal() >= before.ordinal(), "confidence rose from " + before + " to " + after);
        }

        @Test
        void everyFindingWithDiscardedCitations_IsIndeterminate() {
            Rulebook rulebook = rulebook(
                    insolvencyRule(List.of("Art. 5", "Art. 99")),
                    rule("R-443", "true", SeverityLevel.CRITICAL, ConfidenceLevel.HIGH));

            RuleEvaluation evaluation = engine.evaluate(rulebook, insolvent(), "Art. 5");

            for (RuleOutcome outcome : evaluation.withState(RuleState.TRIGGERED)) {
                RuleOutcome.Triggered triggered = (RuleOutcome.Triggered) outcome;
                if (!triggered.discardedCitations().isEmpty()) {
                    assertEquals(ConfidenceLevel.INDETERMINATE, triggered.risk().confidence(), triggered.ruleId());
                }
            }
            assertEquals(2, evaluation.count(RuleState.TRIGGERED));
        }
    }

    @Nested
    @DisplayName("failure isolation")
    class FailureIsolation {

        @Test
        void falseCondition_ShouldDiscardRule() {
            RuleEvaluation evaluation = engine.evaluate(rulebook(insolvencyRule(List.of("Art. 5"))),
                    CaseVariables.of(Map.of("insolvencia_actual", false)), "Art. 5");

            RuleOutcome.Discarded discarded = (RuleOutcome.Discarded) evaluation.outcomes().get(0);
            assertEquals(Boolean.FALSE, discarded.conditionResult());
            assertTrue(evaluation.risks().isEmpty());
        }

        @Test
        void malformedCondition_ShouldDiscardWithoutVerdict() {
            RuleEvaluation evaluation = engine.evaluate(
                    rulebook(rule("R-ROTA", "(x ==", SeverityLevel.HIGH, ConfidenceLevel.HIGH, "x")),
                    CaseVariables.of(Map.of("x", 1)), "Art. 443");

            RuleOutcome.Discarded discarded = (RuleOutcome.Discarded) evaluation.outcomes().get(0);
            assertNull(discarded.conditionResult());
            RuleDecision decision = RuleEngine.toDecision(discarded);
            assertEquals("Condición no evaluable: (x ==", decision.rationale());
            assertEquals(0.0, decision.score());
        }

        @Test
        void brokenRule_ShouldNotAbortTheRest() {
            RuleDefinition withoutOutputs = RuleDefinition.builder()
                    .ruleId("R-SIN-SALIDAS")
                    .riskType("roto")
                    .trigger("true")
                    .build();
            RuleDefinition withoutTrigger = RuleDefinition.builder()
                    .ruleId("R-SIN-TRIGGER")
                    .riskType("roto")
                    .outputs("d", "r")
                    .build();
            Rulebook rulebook = rulebook(withoutOutputs, withoutTrigger,
                    rule("R-OK", "true", SeverityLevel.MEDIUM, ConfidenceLevel.HIGH));

            RuleEvaluation evaluation = engine.evaluate(rulebook, CaseVariables.empty(), "Art. 443");
            RuleEngineResult result = engine.buildEngineResult("case-err", rulebook, evaluation);

            assertEquals(RuleState.ERRORED, evaluation.outcomes().get(0).state());
            assertEquals(RuleState.ERRORED, evaluation.outcomes().get(1).state());
            assertEquals(RuleState.TRIGGERED, evaluation.outcomes().get(2).state());
            assertEquals(List.of("R-OK"), result.triggeredRules().stream().map(RuleDecision::ruleId).toList());
            assertEquals(2, result.discardedRules().size());
            assertTrue(result.flag(RuleEngine.FLAG_HAS_ERRORED_RULES));
            assertTrue(result.isPartitionConsistent());
        }
    }

    @Nested
    @DisplayName("aggregate result")
    class AggregateResult {

        @Test
        void noRisks_ShouldBeConfidentNoRiskConclusion() {
            LegalAgentResult result = engine.buildResult("case-0", List.of());

            assertFalse(result.hasRisks());
            assertEquals(ConfidenceLevel.HIGH, result.confidenceLevel());
            assertEquals(RuleEngine.NO_RISKS_CONCLUSION, result.legalConclusion());
            assertTrue(result.legalBasis().isEmpty());
        }

        @Test
        void emptyRulebook_ShouldStillProduceWellFormedResult() {
            Rulebook empty = rulebook();
            RuleEvaluation evaluation = engine.evaluate(empty, CaseVariables.empty(), "");

            LegalAgentResult legal = engine.buildResult("case-empty", evaluation);
            RuleEngineResult result = engine.buildEngineResult("case-empty", empty, evaluation);

            assertEquals(ConfidenceLevel.HIGH, legal.confidenceLevel());
            assertTrue(result.evaluatedRules().isEmpty());
            assertTrue(result.flag(RuleEngine.FLAG_LEGAL_CONTEXT_EMPTY));
            assertFalse(result.flag(RuleEngine.FLAG_HAS_TRIGGERED_RULES));
        }

        @Test
        void lowOnlyRisks_ShouldGiveLowConfidence() {
            LegalAgentResult result = engine.buildResult("case-low", engine.evaluate(
                    rulebook(rule("R-BAJA", "true", SeverityLevel.LOW, ConfidenceLevel.HIGH)),
                    CaseVariables.empty(), "Art. 443"));

            assertEquals(ConfidenceLevel.LOW, result.confidenceLevel());
        }

        @Test
        void conclusion_ShouldCountRisksAndListArticlesInFirstSeenOrder() {
            Rulebook rulebook = rulebook(
                    insolvencyRule(List.of("Art. 5")),
                    rule("R-443", "true", SeverityLevel.HIGH, ConfidenceLevel.HIGH));

            LegalAgentResult result = engine.buildResult("case-1",
                    engine.evaluate(rulebook, insolvent(), "Art. 5 y Art. 443"));

            assertEquals("Se detectaron 2 riesgo(s) legal(es). Artículos relevantes: Art. 5, Art. 443",
                    result.legalConclusion());
            assertEquals(List.of("Art. 5", "Art. 443"), result.legalBasis());
        }

        @Test
        void conclusion_ShouldCapListedArticles() {
            RuleEngine terse = new RuleEngine(CLOCK, 1);
            Rulebook rulebook = rulebook(
                    insolvencyRule(List.of("Art. 5")),
                    rule("R-443", "true", SeverityLevel.HIGH, ConfidenceLevel.HIGH));

            LegalAgentResult result = terse.buildResult("case-1",
                    terse.evaluate(rulebook, insolvent(), "Art. 5 y Art. 443"));

            assertEquals("Se detectaron 2 riesgo(s) legal(es). Artículos relevantes: Art. 5", result.legalConclusion());
            assertEquals(2, result.legalBasis().size());
        }

        @Test
        void engineResult_ShouldScoreDecisionsByEvidence() {
            Rulebook rulebook = rulebook(
                    insolvencyRule(List.of("Art. 5", "Art. 6")),
                    rule("R-443", "true", SeverityLevel.CRITICAL, ConfidenceLevel.HIGH),
                    rule("R-NO", "false", SeverityLevel.LOW, ConfidenceLevel.LOW));

            RuleEngineResult result = engine.buildEngineResult("case-s", rulebook,
                    engine.evaluate(rulebook, insolvent(), "Art. 5, Art. 443"));

            Map<String, Double> scores = result.evaluatedRules().stream()
                    .collect(Collectors.toMap(RuleDecision::ruleId, RuleDecision::score));
            assertEquals(Map.of("R-INSOLVENCIA", 0.5, "R-443", 1.0, "R-NO", 0.0), scores);
            assertTrue(result.flag(RuleEngine.FLAG_HAS_CRITICAL_RISK));
            assertTrue(result.flag(RuleEngine.FLAG_HAS_HIGH_RISK));
            assertTrue(result.flag(RuleEngine.FLAG_HAS_DISCARDED_CITATIONS));
            assertFalse(result.flag(RuleEngine.FLAG_LEGAL_CONTEXT_EMPTY));
            assertEquals("2.0.0", result.engineVersion());
            assertEquals("test-1", result.rulebookVersion());
            assertTrue(result.isPartitionConsistent());
        }
    }

    @Test
    void identicalInputs_ShouldGiveIdenticalHashes() {
        Rulebook rulebook = rulebook(
                insolvencyRule(List.of("Art. 5", "Art. 6")),
                rule("R-443", "true", SeverityLevel.HIGH, ConfidenceLevel.MEDIUM));
        CaseVariables variables = insolvent();
        RuleEngine later = new RuleEngine(Clock.fixed(Instant.parse("2030-01-01T00:00:00Z"), ZoneOffset.UTC), 5);

        RuleEngineResult first = engine.buildEngineResult("case-d", rulebook, engine.evaluate(rulebook, variables, "Art. 5"));
        RuleEngineResult second = later.buildEngineResult("case-d", rulebook, later.evaluate(rulebook, variables, "Art. 5"));

        assertNotEquals(first.evaluatedAt(), second.evaluatedAt());
        assertEquals(first.evaluatedRules(), second.evaluatedRules());
        assertEquals(first.toDeterministicHash(), second.toDeterministicHash());
    }

    @Test
    void concurrentEvaluations_ShouldNotInterfere() {
        Rulebook rulebook = rulebook(
                insolvencyRule(List.of("Art. 5")),
                rule("R-443", "true", SeverityLevel.HIGH, ConfidenceLevel.MEDIUM));

        long distinctHashes = IntStream.range(0, 64).parallel()
                .mapToObj(i -> engine.buildEngineResult("case-p", rulebook,
                        engine.evaluate(rulebook, insolvent(), "Art. 5 y Art. 443")).toDeterministicHash())
                .distinct()
                .count();

        assertEquals(1, distinctHashes);
    }
}
