package com.example.contractlens.parser.syntax;

import java.util.List;

/** Root of the tree built from one source text. */
public record SourceUnit(List<Declaration> members, List<SyntaxDiagnostic> diagnostics) {
    public SourceUnit {
        members = List.copyOf(members);
        diagnostics = List.copyOf(diagnostics);
    }
}
