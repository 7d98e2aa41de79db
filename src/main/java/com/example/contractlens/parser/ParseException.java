package com.example.contractlens.parser;

/**
 * Raised when source text cannot be tokenized at all. Recoverable syntax errors never
 * surface as this exception; they are collected as diagnostics instead.
 */
public class ParseException extends Exception {
    private final String reason;
    private final int line;
    private final int column;

    public ParseException(String reason, int line, int column) {
        super(String.format(
                "Failed to parse Solidity source code: %s (line %d, column %d)", reason, line, column));
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    public String getReason() {
        return reason;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
