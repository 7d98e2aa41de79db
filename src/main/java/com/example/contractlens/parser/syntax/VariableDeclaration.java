package com.example.contractlens.parser.syntax;

import com.example.contractlens.domain.LineSpan;

/**
 * A parameter, struct member or local variable.
 *
 * @param name empty when the declaration is unnamed
 * @param storageLocation null when no location keyword was given
 */
public record VariableDeclaration(
        TypeName typeName, String name, String storageLocation, boolean indexed, LineSpan span) {
    public VariableDeclaration {
        name = name == null ? "" : name;
    }
}
