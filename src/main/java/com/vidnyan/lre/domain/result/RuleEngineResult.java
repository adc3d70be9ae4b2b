package com.vidnyan.lre.domain.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Official output of one rule engine run.
 * <p>
 * {@code evaluatedRules} holds every evaluated rule, {@code triggeredRules} and
 * {@code discardedRules} partition it. Built once through {@link Builder}; never mutated.
 * The canonical hash ignores {@code evaluatedAt} and {@code executionTimeMs}.
 */
public record RuleEngineResult(
    @JsonProperty("case_id") String caseId,
    @JsonProperty("engine_version") String engineVersion,
    @JsonProperty("rulebook_version") String rulebookVersion,
    @JsonProperty("evaluated_rules") List<RuleDecision> evaluatedRules,
    @JsonProperty("triggered_rules") List<RuleDecision> triggeredRules,
    @JsonProperty("discarded_rules") List<RuleDecision> discardedRules,
    @JsonProperty("summary_flags") SortedMap<String, Boolean> summaryFlags,
    @JsonProperty("evaluated_at") Instant evaluatedAt,
    @JsonProperty("execution_time_ms") long executionTimeMs
) {

    public static final String ENGINE_VERSION = "2.0.0";

    public RuleEngineResult {
        evaluatedRules = List.copyOf(evaluatedRules);
        triggeredRules = List.copyOf(triggeredRules);
        discardedRules = List.copyOf(discardedRules);
        summaryFlags = Collections.unmodifiableSortedMap(new TreeMap<>(summaryFlags));
    }

    /**
     * SHA-256 of the deterministic content: identical inputs always give the identical hash.
     */
    public String toDeterministicHash() {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("case_id", caseId);
        content.put("engine_version", engineVersion);
        content.put("rulebook_version", rulebookVersion);
        content.put("evaluated_rules", evaluatedRules.stream()
                .sorted(Comparator.comparing(RuleDecision::ruleId))
                .toList());
        content.put("summary_flags", summaryFlags);
        return CanonicalHash.sha256(content);
    }

    /**
     * Triggered and discarded are disjoint, their union is the evaluated set,
     * and {@code applies} agrees with the side each decision is on.
     */
    @JsonIgnore
    public boolean isPartitionConsistent() {
        Set<String> evaluated = ids(evaluatedRules);
        Set<String> triggered = ids(triggeredRules);
        Set<String> discarded = ids(discardedRules);

        if (!evaluated.containsAll(triggered) || !evaluated.containsAll(discarded)) {
            return false;
        }
        Set<String> union = new HashSet<>(triggered);
        union.addAll(discarded);
        if (!union.equals(evaluated)) {
            return false;
        }
        Set<String> overlap = new HashSet<>(triggered);
        overlap.retainAll(discarded);
        if (!overlap.isEmpty()) {
            return false;
        }
        return triggeredRules.stream().allMatch(RuleDecision::applies)
                && discardedRules.stream().noneMatch(RuleDecision::applies)
                && evaluatedRules.size() == triggeredRules.size() + discardedRules.size();
    }

    public boolean flag(String name) {
        return summaryFlags.getOrDefault(name, false);
    }

    private static Set<String> ids(List<RuleDecision> decisions) {
        return decisions.stream().map(RuleDecision::ruleId).collect(Collectors.toSet());
    }

    public static Builder builder(String caseId, String rulebookVersion) {
        return new Builder(caseId, rulebookVersion, Clock.systemUTC());
    }

    public static Builder builder(String caseId, String rulebookVersion, Clock clock) {
        return new Builder(caseId, rulebookVersion, clock);
    }

    /**
     * Collects decisions and flags; {@link #build()} splits triggered from discarded.
     */
    public static final class Builder {
        private final String caseId;
        private final String rulebookVersion;
        private final Clock clock;
        private final Instant startedAt;
        private final List<RuleDecision> evaluated = new ArrayList<>();
        private final SortedMap<String, Boolean> flags = new TreeMap<>();

        private Builder(String caseId, String rulebookVersion, Clock clock) {
            if (caseId == null || caseId.isBlank()) {
                throw new IllegalArgumentException("case_id is required");
            }
            this.caseId = caseId;
            this.rulebookVersion = rulebookVersion;
            this.clock = clock;
            this.startedAt = clock.instant();
        }

        public Builder addRuleDecision(RuleDecision decision) {
            evaluated.add(decision);
            return this;
        }

        public Builder addFlag(String name, boolean value) {
            flags.put(name, value);
            return this;
        }

        public RuleEngineResult build() {
            Instant finishedAt = clock.instant();
            List<RuleDecision> triggered = evaluated.stream().filter(RuleDecision::applies).toList();
            List<RuleDecision> discarded = evaluated.stream().filter(d -> !d.applies()).toList();
            return new RuleEngineResult(
                    caseId,
                    ENGINE_VERSION,
                    rulebookVersion,
                    evaluated,
                    triggered,
                    discarded,
                    flags,
                    finishedAt,
                    Duration.between(startedAt, finishedAt).toMillis());
        }
    }
}
