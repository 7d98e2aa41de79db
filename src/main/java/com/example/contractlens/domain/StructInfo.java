package com.example.contractlens.domain;

import java.util.List;

public record StructInfo(String name, List<Member> members, LineSpan span) implements Named {
    public StructInfo {
        members = List.copyOf(members);
    }

    public record Member(String name, String type) {}
}
