package com.example.contractlens.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Every structural change belongs to exactly one of these categories. */
public enum ChangeCategory {
    FUNCTION,
    EVENT,
    VARIABLE,
    MODIFIER,
    IMPORT,
    INHERITANCE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
