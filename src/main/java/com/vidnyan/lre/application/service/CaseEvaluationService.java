package com.vidnyan.lre.application.service;

import com.vidnyan.lre.application.port.in.EvaluateCaseUseCase;
import com.vidnyan.lre.application.port.out.RiskExplainer;
import com.vidnyan.lre.application.port.out.RulebookRepository;
import com.vidnyan.lre.domain.engine.LegalAgentResult;
import com.vidnyan.lre.domain.engine.RuleEngine;
import com.vidnyan.lre.domain.engine.RuleEvaluation;
import com.vidnyan.lre.domain.expression.CaseVariables;
import com.vidnyan.lre.domain.result.RuleEngineResult;
import com.vidnyan.lre.domain.rule.Rulebook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Main application service that orchestrates a case evaluation.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CaseEvaluationService implements EvaluateCaseUseCase {

    private final RulebookRepository rulebookRepository;
    private final RuleEngine ruleEngine;
    private final RiskExplainer riskExplainer;

    @Override
    public EvaluationResponse evaluate(EvaluationRequest request) {
        log.info("Starting evaluation of case: {}", request.caseId());

        // Step 1: Resolve rulebook
        Rulebook rulebook = request.rulebook() != null
                ? request.rulebook()
                : rulebookRepository.loadDefault();
        log.info("Step 1: Using rulebook {} with {} rules",
                rulebook.version().orElse("unversioned"), rulebook.size());

        // Step 2: Snapshot case variables
        CaseVariables variables = CaseVariables.of(request.variables());
        log.info("Step 2: {} case variables, {} chars of legal context",
                variables.size(), request.legalContext().length());

        // Step 3: Evaluate rules
        RuleEvaluation evaluation = ruleEngine.evaluate(rulebook, variables, request.legalContext());

        // Step 4: Build results
        LegalAgentResult legalResult = ruleEngine.buildResult(request.caseId(), evaluation);
        RuleEngineResult engineResult = ruleEngine.buildEngineResult(request.caseId(), rulebook, evaluation);
        String hash = engineResult.toDeterministicHash();
        log.info("Step 4: {} risk(s), overall confidence {}, hash {}",
                legalResult.legalRisks().size(), legalResult.confidenceLevel().label(), hash);

        // Step 5: Explain
        RiskExplainer.Explanation explanation = riskExplainer.explain(legalResult, engineResult);

        log.info("Evaluation of case {} complete in {}ms", request.caseId(), engineResult.executionTimeMs());
        return new EvaluationResponse(legalResult, engineResult, hash, explanation);
    }
}
