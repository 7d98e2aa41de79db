package com.example.contractlens.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Distinguishes regular functions from the unnamed special entry points. Special
 * functions carry an empty name; their kind is never inferred from the name.
 */
public enum FunctionKind {
    FUNCTION,
    CONSTRUCTOR,
    FALLBACK,
    RECEIVE;

    @JsonValue
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
