package com.example.contractlens.domain;

import java.util.List;

public record ModifierInfo(String name, List<Parameter> parameters, LineSpan span) implements Named {
    public ModifierInfo {
        parameters = List.copyOf(parameters);
    }
}
