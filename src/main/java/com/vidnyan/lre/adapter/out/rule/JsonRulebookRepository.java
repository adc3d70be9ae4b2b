package com.vidnyan.lre.adapter.out.rule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.lre.LreProperties;
import com.vidnyan.lre.application.port.out.RulebookLoadException;
import com.vidnyan.lre.application.port.out.RulebookRepository;
import com.vidnyan.lre.application.port.out.RulebookValidationException;
import com.vidnyan.lre.domain.expression.ExpressionException;
import com.vidnyan.lre.domain.expression.ExpressionTokenizer;
import com.vidnyan.lre.domain.rule.ConfidenceLevel;
import com.vidnyan.lre.domain.rule.EscalationLadder;
import com.vidnyan.lre.domain.rule.EvidenceRequired;
import com.vidnyan.lre.domain.rule.LadderLevel;
import com.vidnyan.lre.domain.rule.RuleDefinition;
import com.vidnyan.lre.domain.rule.RuleOutputs;
import com.vidnyan.lre.domain.rule.Rulebook;
import com.vidnyan.lre.domain.rule.SeverityLevel;
import com.vidnyan.lre.domain.rule.Trigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * JSON based rulebook repository.
 * Loads a rulebook from a file, a stream or a Spring resource location, and rejects
 * incomplete rulebooks with the full list of violated field paths.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonRulebookRepository implements RulebookRepository {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final LreProperties properties;

    private final ExpressionTokenizer tokenizer = new ExpressionTokenizer();

    private volatile Rulebook defaultRulebook;

    @Override
    public Rulebook load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new RulebookLoadException("Rulebook not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new RulebookLoadException("Failed to read rulebook " + path, e);
        }
    }

    @Override
    public Rulebook load(InputStream source, String sourceName) {
        JsonNode root;
        try {
            root = objectMapper.readTree(source);
        } catch (IOException e) {
            throw new RulebookLoadException("Malformed JSON in rulebook " + sourceName + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || !root.isObject()) {
            throw new RulebookValidationException(sourceName, List.of("$: expected a JSON object"));
        }

        RulebookDto dto;
        try {
            dto = objectMapper.treeToValue(root, RulebookDto.class);
        } catch (JsonProcessingException e) {
            throw new RulebookLoadException("Rulebook " + sourceName + " has an unexpected structure: "
                    + e.getOriginalMessage(), e);
        }

        List<String> violations = validate(dto);
        if (!violations.isEmpty()) {
            violations.forEach(v -> log.warn("Rulebook {} violation: {}", sourceName, v));
            throw new RulebookValidationException(sourceName, violations);
        }

        Rulebook rulebook = new Rulebook(dto.metadata, dto.rules.stream().map(this::mapToRule).toList());
        log.info("Loaded rulebook {} with {} rules from {}",
                rulebook.version().orElse("unversioned"), rulebook.size(), sourceName);
        return rulebook;
    }

    @Override
    public Rulebook loadDefault() {
        Rulebook cached = defaultRulebook;
        if (cached != null) {
            return cached;
        }
        synchronized (this) {
            if (defaultRulebook == null) {
                defaultRulebook = loadFirstAvailable(properties.getRulebook().candidates());
            }
            return defaultRulebook;
        }
    }

    private Rulebook loadFirstAvailable(List<String> locations) {
        for (String location : locations) {
            Resource resource = resourceLoader.getResource(location);
            if (!resource.exists()) {
                log.debug("No rulebook at {}", location);
                continue;
            }
            try (InputStream in = resource.getInputStream()) {
                return load(in, location);
            } catch (IOException e) {
                throw new RulebookLoadException("Failed to read rulebook " + location, e);
            }
        }
        throw new RulebookLoadException("No rulebook found in any location: " + locations);
    }

    List<String> validate(RulebookDto dto) {
        List<String> violations = new ArrayList<>();
        if (dto.metadata == null) {
            violations.add("metadata: required");
        }
        if (dto.rules == null) {
            violations.add("rules: required");
            return violations;
        }

        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < dto.rules.size(); i++) {
            String path = "rules[" + i + "]";
            RuleDto rule = dto.rules.get(i);
            if (rule == null) {
                violations.add(path + ": required");
                continue;
            }

            if (isBlank(rule.ruleId)) {
                violations.add(path + ".rule_id: required");
            } else if (!seenIds.add(rule.ruleId)) {
                violations.add(path + ".rule_id: duplicate '" + rule.ruleId + "'");
            }
            if (isBlank(rule.riskType)) {
                violations.add(path + ".risk_type: required");
            }
            if (rule.articleRefs == null) {
                violations.add(path + ".article_refs: required");
            } else {
                validateElements(rule.articleRefs, path + ".article_refs", violations);
            }
            validateTrigger(rule.trigger, path + ".trigger", violations);
            if (rule.evidenceRequired == null) {
                violations.add(path + ".evidence_required: required");
            } else {
                validateElements(rule.evidenceRequired.documentTypes, path + ".evidence_required.document_types", violations);
                validateElements(rule.evidenceRequired.descriptions, path + ".evidence_required.descriptions", violations);
            }
            validateLadder(rule.severityLogic, path + ".severity_logic", SeverityLevel::fromRulebookKey, violations);
            validateLadder(rule.confidenceLogic, path + ".confidence_logic", ConfidenceLevel::fromRulebookKey, violations);
            validateOutputs(rule.outputs, path + ".outputs", violations);
        }
        return violations;
    }

    private void validateTrigger(TriggerDto trigger, String path, List<String> violations) {
        if (trigger == null) {
            violations.add(path + ": required");
            return;
        }
        validateElements(trigger.variablesRequired, path + ".variables_required", violations);
        if (isBlank(trigger.condition)) {
            violations.add(path + ".condition: required");
            return;
        }

        Set<String> referenced;
        try {
            referenced = tokenizer.referencedVariables(trigger.condition);
        } catch (ExpressionException e) {
            // unparseable conditions surface per rule at evaluation time
            log.debug("Skipping variable check for {}: {}", path, e.getMessage());
            return;
        }
        Set<String> declared = trigger.variablesRequired == null
                ? Set.of()
                : new HashSet<>(trigger.variablesRequired);
        for (String variable : referenced) {
            if (!declared.contains(variable)) {
                violations.add(path + ".variables_required: '" + variable + "' is used by the condition but not declared");
            }
        }
    }

    private static void validateElements(List<String> values, String path, List<String> violations) {
        if (values == null) {
            return;
        }
        for (int j = 0; j < values.size(); j++) {
            if (values.get(j) == null) {
                violations.add(path + "[" + j + "]: must not be null");
            }
        }
    }

    private static void validateLadder(Map<String, String> ladder, String path,
                                       Function<String, Optional<?>> levelLookup, List<String> violations) {
        if (ladder == null) {
            violations.add(path + ": required");
            return;
        }
        for (String key : ladder.keySet()) {
            if (levelLookup.apply(key).isEmpty()) {
                violations.add(path + "." + key + ": unknown level");
            }
        }
    }

    private static void validateOutputs(OutputsDto outputs, String path, List<String> violations) {
        if (outputs == null) {
            violations.add(path + ": required");
            return;
        }
        if (outputs.descriptionTemplate == null) {
            violations.add(path + ".description_template: required");
        }
        if (outputs.recommendationTemplate == null) {
            violations.add(path + ".recommendation_template: required");
        }
    }

    private RuleDefinition mapToRule(RuleDto dto) {
        return RuleDefinition.builder()
                .ruleId(dto.ruleId)
                .riskType(dto.riskType)
                .articleRefs(dto.articleRefs)
                .trigger(new Trigger(dto.trigger.condition, dto.trigger.variablesRequired == null
                        ? Set.of()
                        : new LinkedHashSet<>(dto.trigger.variablesRequired)))
                .evidenceRequired(new EvidenceRequired(dto.evidenceRequired.documentTypes,
                        dto.evidenceRequired.descriptions))
                .severityLogic(mapLadder(SeverityLevel.class, dto.severityLogic, SeverityLevel::fromRulebookKey))
                .confidenceLogic(mapLadder(ConfidenceLevel.class, dto.confidenceLogic, ConfidenceLevel::fromRulebookKey))
                .outputs(new RuleOutputs(dto.outputs.descriptionTemplate, dto.outputs.recommendationTemplate,
                        dto.outputs.missingDataTemplate))
                .build();
    }

    private static <L extends Enum<L> & LadderLevel> EscalationLadder<L> mapLadder(
            Class<L> levelType, Map<String, String> dto, Function<String, Optional<L>> levelLookup) {
        EnumMap<L, String> conditions = new EnumMap<>(levelType);
        dto.forEach((key, condition) -> levelLookup.apply(key).ifPresent(level -> conditions.put(level, condition)));
        return EscalationLadder.of(levelType, conditions);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // DTO classes for JSON deserialization
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RulebookDto {
        public Map<String, Object> metadata;
        public List<RuleDto> rules;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RuleDto {
        @JsonProperty("rule_id") public String ruleId;
        @JsonProperty("risk_type") public String riskType;
        @JsonProperty("article_refs") public List<String> articleRefs;
        public TriggerDto trigger;
        @JsonProperty("evidence_required") public EvidenceRequiredDto evidenceRequired;
        @JsonProperty("severity_logic") public Map<String, String> severityLogic;
        @JsonProperty("confidence_logic") public Map<String, String> confidenceLogic;
        public OutputsDto outputs;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TriggerDto {
        public String condition;
        @JsonProperty("variables_required") public List<String> variablesRequired;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class EvidenceRequiredDto {
        @JsonProperty("document_types") public List<String> documentTypes;
        public List<String> descriptions;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class OutputsDto {
        @JsonProperty("description_template") public String descriptionTemplate;
        @JsonProperty("recommendation_template") public String recommendationTemplate;
        @JsonProperty("missing_data_template") public String missingDataTemplate;
    }
}
