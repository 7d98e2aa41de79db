package com.example.contractlens.domain;

import java.util.List;

public record EventInfo(String name, List<Parameter> parameters, LineSpan span) implements Named {
    public EventInfo {
        parameters = List.copyOf(parameters);
    }
}
