package com.vidnyan.lre.adapter.in.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.lre.application.port.in.EvaluateCaseUseCase;
import com.vidnyan.lre.application.port.in.EvaluateCaseUseCase.EvaluationRequest;
import com.vidnyan.lre.application.port.in.EvaluateCaseUseCase.EvaluationResponse;
import com.vidnyan.lre.application.port.out.RiskExplainer;
import com.vidnyan.lre.domain.engine.LegalRisk;
import com.vidnyan.lre.domain.result.RuleEngineResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * CLI Runner for standalone case evaluation.
 * Runs when the lre.evaluate.variables property is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EvaluationCliRunner implements CommandLineRunner {

    private final EvaluateCaseUseCase evaluateCaseUseCase;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext context;

    @Value("${lre.evaluate.variables:}")
    private String variablesPath;

    @Value("${lre.evaluate.legal-context:}")
    private String legalContextPath;

    @Value("${lre.evaluate.case-id:cli-case}")
    private String caseId;

    @Override
    public void run(String... args) throws Exception {
        if (variablesPath == null || variablesPath.isBlank()) {
            log.info("No case specified. Set lre.evaluate.variables property.");
            return;
        }

        int exitCode = 0;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║           LRE - Legal Rule Evaluation Engine                 ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Case:      {}", caseId);
            log.info("║ Variables: {}", variablesPath);
            log.info("╚══════════════════════════════════════════════════════════════╝");

            EvaluationRequest request = EvaluationRequest.of(caseId, readVariables(), readLegalContext());
            EvaluationResponse response = evaluateCaseUseCase.evaluate(request);

            printResults(response);
            printExplanation(response.explanation());

            log.info("");
            log.info("Evaluation complete!");
        } catch (IOException e) {
            log.error("Could not read case input: {}", e.getMessage());
            exitCode = 1;
        } catch (RuntimeException e) {
            log.error("Evaluation of case {} failed: {}", caseId, e.getMessage(), e);
            exitCode = 1;
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private Map<String, Object> readVariables() throws IOException {
        return objectMapper.readValue(Path.of(variablesPath).toFile(), new TypeReference<Map<String, Object>>() {});
    }

    private String readLegalContext() throws IOException {
        if (legalContextPath == null || legalContextPath.isBlank()) {
            log.warn("No legal context given; every cited article will be discarded.");
            return "";
        }
        return Files.readString(Path.of(legalContextPath), StandardCharsets.UTF_8);
    }

    private void printResults(EvaluationResponse response) {
        RuleEngineResult engineResult = response.engineResult();

        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" EVALUATION RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Engine version:   {}", engineResult.engineVersion());
        log.info(" Rulebook version: {}", engineResult.rulebookVersion());
        log.info(" Rules evaluated:  {}", engineResult.evaluatedRules().size());
        log.info(" Rules triggered:  {}", engineResult.triggeredRules().size());
        log.info(" Rules discarded:  {}", engineResult.discardedRules().size());
        log.info(" Confidence:       {}", response.legalResult().confidenceLevel().label());
        log.info(" Result hash:      {}", response.resultHash());
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" {}", response.legalResult().legalConclusion());
        log.info("═══════════════════════════════════════════════════════════════");

        if (!response.hasRisks()) {
            return;
        }

        log.info("");
        log.info(" FINDINGS:");
        log.info("───────────────────────────────────────────────────────────────");
        for (LegalRisk risk : response.legalResult().legalRisks()) {
            log.info("");
            log.info(" [{}] {} ({})", risk.severity().label().toUpperCase(), risk.riskType(), risk.ruleId());
            log.info(" Description: {}", risk.description());
            log.info(" Articles:    {}", risk.legalArticles().isEmpty() ? "-" : String.join(", ", risk.legalArticles()));
            log.info(" Confidence:  {}  Evidence: {}", risk.confidence().label(), risk.evidenceStatus().label());
            log.info(" Action:      {}", risk.recommendation());
        }

        if (!response.legalResult().missingData().isEmpty()) {
            log.info("");
            log.info(" MISSING DATA:");
            response.legalResult().missingData().forEach(note -> log.info("   - {}", note));
        }
    }

    private void printExplanation(RiskExplainer.Explanation explanation) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" EXPLANATION");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" {}", explanation.summary());
        for (RiskExplainer.Note note : explanation.notes()) {
            log.info("");
            log.info(" - {}: {}", note.ruleId(), note.text());
        }
        log.info("");
        log.info(" {}", explanation.disclaimer());
    }
}
