package com.example.contractlens.domain;

import java.util.List;

public record EnumInfo(String name, List<String> values, LineSpan span) implements Named {
    public EnumInfo {
        values = List.copyOf(values);
    }
}
