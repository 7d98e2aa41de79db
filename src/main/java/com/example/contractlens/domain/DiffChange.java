package com.example.contractlens.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * One structural difference between two contract models. Instances are produced by
 * the structural differencer; the impact is decided there from the change shape.
 *
 * @param before canonical signature on the old side, null for additions
 * @param after canonical signature on the new side, null for removals
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiffChange(
        ChangeType type,
        ChangeCategory category,
        String name,
        String before,
        String after,
        String description,
        Impact impact,
        String explanation) {
    public DiffChange {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(impact, "impact");
    }

    public boolean isBreaking() {
        return impact == Impact.BREAKING;
    }
}
