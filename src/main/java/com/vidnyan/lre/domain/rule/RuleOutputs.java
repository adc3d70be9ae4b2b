package com.vidnyan.lre.domain.rule;

import java.util.Optional;

/**
 * Text templates of a rule, with {variable} placeholders.
 */
public record RuleOutputs(
    String descriptionTemplate,
    String recommendationTemplate,
    String missingDataTemplate
) {

    public Optional<String> missingData() {
        return Optional.ofNullable(missingDataTemplate).filter(template -> !template.isBlank());
    }
}
