package com.example.contractlens.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate counts for a comparison. {@code linesModified} is an estimate: the overlap
 * of added and removed lines.
 */
@Getter
@Setter
@NoArgsConstructor
public class DiffStats {
    private int linesAdded;
    private int linesRemoved;
    private int linesModified;
    private int functionsAdded;
    private int functionsRemoved;
    private int functionsModified;
    private int eventsAdded;
    private int eventsRemoved;
    private int variablesAdded;
    private int variablesRemoved;
    private int variablesModified;
    private int modifiersAdded;
    private int modifiersRemoved;

    /** Counts for every {@code category:type} pair, zero entries included. */
    private Map<String, Integer> counts = new LinkedHashMap<>();

    public int count(ChangeCategory category, ChangeType type) {
        return counts.getOrDefault(countKey(category, type), 0);
    }

    public static String countKey(ChangeCategory category, ChangeType type) {
        return category.label() + ":" + type.label();
    }
}
