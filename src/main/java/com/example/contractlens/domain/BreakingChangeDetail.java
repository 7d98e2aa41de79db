package com.example.contractlens.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A breaking change as reported in the analysis payload. {@code category} is kept as
 * free text because the semantic collaborator may report categories of its own.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BreakingChangeDetail(
        String name, String category, String reason, String before, String after) {

    public static BreakingChangeDetail from(DiffChange change) {
        return new BreakingChangeDetail(
                change.name(),
                change.category().label(),
                change.explanation() != null ? change.explanation() : change.description(),
                change.before(),
                change.after());
    }
}
