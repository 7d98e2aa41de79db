package com.example.contractlens.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record FunctionInfo(
        String name,
        FunctionKind kind,
        Visibility visibility,
        StateMutability mutability,
        List<Parameter> parameters,
        List<Parameter> returns,
        List<String> modifiers,
        LineSpan span,
        Set<String> calls,
        List<ExternalCall> externalCalls,
        int complexity)
        implements Named {
    public FunctionInfo {
        name = name == null ? "" : name;
        parameters = List.copyOf(parameters);
        returns = List.copyOf(returns);
        modifiers = List.copyOf(modifiers);
        calls = Collections.unmodifiableSet(new LinkedHashSet<>(calls));
        externalCalls = List.copyOf(externalCalls);
        if (complexity < 1) {
            throw new IllegalArgumentException("complexity must be at least 1 but was " + complexity);
        }
    }

    public boolean isConstructor() {
        return kind == FunctionKind.CONSTRUCTOR;
    }

    /** Unnamed entry points are keyed by their kind keyword. */
    @Override
    public String key() {
        return name.isEmpty() ? kind.keyword() : name;
    }
}
