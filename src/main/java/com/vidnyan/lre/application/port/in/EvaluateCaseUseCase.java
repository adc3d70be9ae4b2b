package com.vidnyan.lre.application.port.in;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.lre.application.port.out.RiskExplainer;
import com.vidnyan.lre.domain.engine.LegalAgentResult;
import com.vidnyan.lre.domain.result.RuleEngineResult;
import com.vidnyan.lre.domain.rule.Rulebook;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Primary use case: evaluate one insolvency case against the rulebook.
 * This is the main entry point to the application.
 */
public interface EvaluateCaseUseCase {

    /**
     * Evaluate a case and return its findings with the deterministic engine result.
     * @param request Case facts and retrieved legal text
     * @return Legal assessment, engine result, result hash and explanation
     */
    EvaluationResponse evaluate(EvaluationRequest request);

    /**
     * Evaluation request parameters.
     */
    record EvaluationRequest(
        String caseId,
        Map<String, Object> variables,
        String legalContext,
        Rulebook rulebook        // null = default rulebook
    ) {
        public EvaluationRequest {
            if (caseId == null || caseId.isBlank()) {
                throw new IllegalArgumentException("caseId is required");
            }
            // values may be null, so no Map.copyOf
            variables = variables == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
            legalContext = legalContext == null ? "" : legalContext;
        }

        public static EvaluationRequest of(String caseId, Map<String, Object> variables, String legalContext) {
            return new EvaluationRequest(caseId, variables, legalContext, null);
        }
    }

    /**
     * Evaluation result.
     */
    record EvaluationResponse(
        @JsonProperty("legal_result") LegalAgentResult legalResult,
        @JsonProperty("engine_result") RuleEngineResult engineResult,
        @JsonProperty("result_hash") String resultHash,
        @JsonProperty("explanation") RiskExplainer.Explanation explanation
    ) {
        public boolean hasRisks() {
            return legalResult.hasRisks();
        }
    }
}
