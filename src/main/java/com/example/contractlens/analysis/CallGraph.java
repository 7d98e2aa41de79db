package com.example.contractlens.analysis;

import com.example.contractlens.domain.ExternalCall;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Call facts and complexity gathered from one function body. */
public record CallGraph(int complexity, Set<String> calls, List<ExternalCall> externalCalls) {
    public CallGraph {
        calls = Collections.unmodifiableSet(new LinkedHashSet<>(calls));
        externalCalls = List.copyOf(externalCalls);
    }
}
