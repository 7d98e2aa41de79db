package com.example.contractlens.parser.syntax;

/** A syntax error the tree builder recovered from. */
public record SyntaxDiagnostic(String message, int line, int column) {}
